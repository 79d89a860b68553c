package org.pragmatica.smtfuzz.parser;

import org.pragmatica.smtfuzz.tree.SourceSpan;

/**
 * Token types of the SMT-LIB lexer.
 */
public sealed interface SmtToken {
    SourceSpan span();

    // (
    record LParen(SourceSpan span) implements SmtToken {}

    // )
    record RParen(SourceSpan span) implements SmtToken {}

    /**
     * Simple or {@code |quoted|} symbol; quoted symbols keep their bars in {@code text}.
     */
    record Symbol(SourceSpan span, String text, boolean quoted) implements SmtToken {}

    // :name
    record Keyword(SourceSpan span, String text) implements SmtToken {}

    record Numeral(SourceSpan span, String text) implements SmtToken {}

    record Decimal(SourceSpan span, String text) implements SmtToken {}

    // #x... or #b...
    record Radix(SourceSpan span, String text, boolean hexadecimal) implements SmtToken {}

    /**
     * String constant with escapes already decoded for the lexer's dialect.
     */
    record StringLiteral(SourceSpan span, String value) implements SmtToken {}

    record Eof(SourceSpan span) implements SmtToken {}

    record Error(SourceSpan span, String message) implements SmtToken {}
}
