package org.csu.algolisp.compiler.parser.ast.definition;

import org.csu.algolisp.compiler.parser.ast.DefinitionNode;
import org.csu.algolisp.compiler.parser.ast.form.BindingNode;

/**
 * AST 节点: val 定义
 * e.g., val x = 1; val f(x) = x * 2; val (q, r) = div_mod(7, 2)
 */
public record ValDefinitionNode(BindingNode binding) implements DefinitionNode {
}
