package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.DefinitionNode;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * AST 节点: 代码块 do { defs; cmds; tail }
 *
 * @param definitions leading definitions
 * @param commands    expressions evaluated for effect
 * @param tail        final expression, null only for a loop body
 */
public record DoNode(
        List<DefinitionNode> definitions,
        List<ExpressionNode> commands,
        ExpressionNode tail
) implements ExpressionNode {

    public DoNode {
        definitions = List.copyOf(definitions);
        commands = List.copyOf(commands);
    }

    /**
     * Commands followed by the tail, if there is one.
     */
    public List<ExpressionNode> expressions() {
        List<ExpressionNode> all = new ArrayList<>(commands);
        if (tail != null) {
            all.add(tail);
        }
        return all;
    }
}
