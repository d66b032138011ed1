package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * fn formals -> body
 */
public record LambdaNode(FormalsNode formals, ExpressionNode body) implements ExpressionNode {
}
