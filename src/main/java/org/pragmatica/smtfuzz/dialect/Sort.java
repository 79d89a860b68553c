package org.pragmatica.smtfuzz.dialect;

import org.pragmatica.smtfuzz.tree.ExpressionKind;
import org.pragmatica.smtfuzz.tree.Node;

/**
 * The sorts the fuzzer distinguishes. Anything else is {@link #UNKNOWN}.
 */
public enum Sort {
    BOOL,
    INT,
    STRING,
    REGLAN,
    UNKNOWN;

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Sort named by a sort expression as written in a declaration.
     */
    public static Sort of(Node sortNode) {
        if (!(sortNode instanceof Node.Expression expression)) {
            return UNKNOWN;
        }
        if (expression.is(ExpressionKind.SYMBOL)) {
            return switch (expression.symbol()) {
                case "Bool" -> BOOL;
                case "Int" -> INT;
                case "String" -> STRING;
                case "RegLan", "RegEx" -> REGLAN;
                default -> UNKNOWN;
            };
        }
        // (RegEx String) in the 2.5 draft
        if (expression.is(ExpressionKind.APPLICATION) && expression.symbol().equals("RegEx")) {
            return REGLAN;
        }
        return UNKNOWN;
    }
}
