package org.csu.algolisp.compiler.parser.ast;

/**
 * @author hidyouth
 * @description: 所有AST节点的根接口
 */
public interface AstNode {
}
