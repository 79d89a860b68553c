package org.pragmatica.smtfuzz.tree;

/**
 * Shape of an {@link Node.Expression}. Fixed by the parser; transformers may
 * recompute a literal's text but never change its kind.
 */
public enum ExpressionKind {
    /**
     * Bare identifier without children.
     */
    SYMBOL,
    /**
     * Attribute keyword such as {@code :named}.
     */
    KEYWORD,
    INTEGER_LITERAL,
    DECIMAL_LITERAL,
    HEX_LITERAL,
    BINARY_LITERAL,
    /**
     * String constant; the symbol holds the decoded characters.
     */
    STRING_LITERAL,
    /**
     * {@code (head child*)} with a symbol head.
     */
    APPLICATION,
    /**
     * Two-argument regex character range.
     */
    RE_RANGE,
    /**
     * Single-argument string to regex coercion.
     */
    STR_TO_RE,
    /**
     * Parenthesised list without a symbol head: binders, parameter lists, indexed heads.
     */
    LIST;

    public boolean isLiteral() {
        return switch (this) {
            case INTEGER_LITERAL, DECIMAL_LITERAL, HEX_LITERAL, BINARY_LITERAL, STRING_LITERAL -> true;
            default -> false;
        };
    }

    public boolean isAtom() {
        return isLiteral() || this == SYMBOL || this == KEYWORD;
    }

    public boolean isApplication() {
        return this == APPLICATION || this == RE_RANGE || this == STR_TO_RE;
    }
}
