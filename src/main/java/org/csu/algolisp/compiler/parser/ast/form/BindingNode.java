package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * One {@code target = value} binding, shared by val definitions and the let family.
 *
 * @param target     a bare name, or a parenthesised list when destructuring
 * @param parameters non-null for the function shorthand {@code f(x, y) = body}
 * @param value      bound expression (or transformer for syntax bindings)
 * @param token      first token of the binding
 */
public record BindingNode(
        FormalsNode target,
        FormalsNode parameters,
        ExpressionNode value,
        Token token
) {

    public boolean isDestructuring() {
        return !target.bare();
    }

    public String name() {
        return target.names().get(0);
    }
}
