package org.pragmatica.smtfuzz.error;

import org.pragmatica.smtfuzz.tree.SourceLocation;

/**
 * Reason a problem text was rejected, with the location it was detected at.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Unexpected token.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Input ended inside a form.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Top-level form with a command the fuzzer does not know.
     */
    record UnknownCommand(
    SourceLocation location,
    String command) implements ParseError {
        @Override
        public String message() {
            return "Unknown command '" + command + "' at " + location;
        }
    }

    /**
     * Lexical error: unterminated literal, stray character, oversized input.
     */
    record InvalidToken(
    SourceLocation location,
    String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }
}
