package org.csu.algolisp.compiler.parser.ast;

/**
 * 表达式节点的标记接口
 */
public interface ExpressionNode extends AstNode {
}
