package org.csu.algolisp.compiler.lexer;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps surface identifiers onto Scheme symbol names.
 * <p>
 * The rules are tried in order and the first match wins; the captured parts of a matching
 * rule (and every identifier no rule matches) get the plain underscore to hyphen substitution.
 */
public final class NameTranslator {

    private record Rule(Pattern pattern, String replacement) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("^is_(.+)$"), "$1?"),
            new Rule(Pattern.compile("^(.+?)_to_(.+)$"), "$1->$2"),
            new Rule(Pattern.compile("^(.+)_set$"), "$1-set!"),
            new Rule(Pattern.compile("^set_(.+)$"), "set-$1!"),
            new Rule(Pattern.compile("^(.+)_add$"), "$1+"),
            new Rule(Pattern.compile("^(.+)_sub$"), "$1-"),
            new Rule(Pattern.compile("^(.+)_mul$"), "$1*"),
            new Rule(Pattern.compile("^(.+)_eq$"), "$1="),
            new Rule(Pattern.compile("^(.+)_lt$"), "$1<"),
            new Rule(Pattern.compile("^(.+)_gt$"), "$1>"),
            new Rule(Pattern.compile("^(.+)_bang$"), "$1!")
    );

    private NameTranslator() {
    }

    public static String translate(String identifier) {
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(identifier);
            if (matcher.matches()) {
                StringBuilder sb = new StringBuilder();
                String replacement = rule.replacement();
                for (int i = 0; i < replacement.length(); i++) {
                    char c = replacement.charAt(i);
                    if (c == '$') {
                        int group = replacement.charAt(++i) - '0';
                        sb.append(hyphenate(matcher.group(group)));
                    } else {
                        sb.append(c);
                    }
                }
                return sb.toString();
            }
        }
        return hyphenate(identifier);
    }

    /**
     * An identifier with at least one letter and no lowercase letter is a symbolic constant.
     */
    public static boolean isConstant(String identifier) {
        boolean hasLetter = false;
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (Character.isLetter(c)) {
                if (!Character.isUpperCase(c)) {
                    return false;
                }
                hasLetter = true;
            }
        }
        return hasLetter;
    }

    public static String translateConstant(String identifier) {
        return hyphenate(identifier.toLowerCase(Locale.ROOT));
    }

    private static String hyphenate(String part) {
        return part.replace('_', '-');
    }
}
