package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.lexer.Token;

import java.util.List;

/**
 * A parameter list. {@code x} alone is bare; {@code (x, @r)} has a rest parameter.
 *
 * @param names required parameter names, already translated
 * @param rest  name after {@code @}, or null
 * @param bare  written without parentheses
 * @param token first token, for error positions
 */
public record FormalsNode(List<String> names, String rest, boolean bare, Token token) {

    public FormalsNode {
        names = List.copyOf(names);
    }

    public static FormalsNode single(String name, Token token) {
        return new FormalsNode(List.of(name), null, true, token);
    }

    public boolean hasRest() {
        return rest != null;
    }
}
