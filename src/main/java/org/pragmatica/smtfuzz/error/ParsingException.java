package org.pragmatica.smtfuzz.error;

import org.pragmatica.smtfuzz.tree.SourceLocation;

/**
 * Problem text violates the grammar of the requested dialect.
 */
public class ParsingException extends Exception {
    private final ParseError error;

    public ParsingException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    public SourceLocation location() {
        return error.location();
    }

    /**
     * Diagnostic pointing at the offending location.
     */
    public Diagnostic diagnostic() {
        return Diagnostic.of(error);
    }
}
