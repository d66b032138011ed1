package org.csu.algolisp.compiler.parser.ast.expression;

import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个标识符
 *
 * @param name  已翻译的Scheme名字, e.g. "null?" for is_null
 * @param token 源Token, kept for error positions
 */
public record IdentifierNode(String name, Token token) implements ExpressionNode {
}
