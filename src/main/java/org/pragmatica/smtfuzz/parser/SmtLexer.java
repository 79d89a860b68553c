package org.pragmatica.smtfuzz.parser;

import org.pragmatica.smtfuzz.dialect.Dialect;
import org.pragmatica.smtfuzz.dialect.StringLiterals;
import org.pragmatica.smtfuzz.tree.SourceLocation;
import org.pragmatica.smtfuzz.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for SMT-LIB problem text. Lexical errors become {@link SmtToken.Error}
 * tokens; the token list always ends with {@link SmtToken.Eof}.
 */
public final class SmtLexer {
    static final int MAX_INPUT_SIZE = 16 * 1024 * 1024;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;
    private static final String SYMBOL_PUNCTUATION = "~!@$%^&*_-+=<>.?/";

    private final String input;
    private final Dialect dialect;
    private int pos;
    private int line;
    private int column;

    private SmtLexer(String input, Dialect dialect) {
        this.input = input;
        this.dialect = dialect;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<SmtToken> tokenize(String input, Dialect dialect) {
        if (input.length() > MAX_INPUT_SIZE) {
            return List.of(new SmtToken.Error(SourceSpan.at(SourceLocation.START),
                                              "Input exceeds maximum size of " + MAX_INPUT_SIZE + " characters"),
                           new SmtToken.Eof(SourceSpan.at(SourceLocation.START)));
        }
        return new SmtLexer(input, dialect).tokenizeAll();
    }

    private List<SmtToken> tokenizeAll() {
        var tokens = new ArrayList<SmtToken>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (!isAtEnd()) {
                var token = nextToken();
                tokens.add(token);
                if (token instanceof SmtToken.Error) {
                    break;
                }
            }
        }
        tokens.add(new SmtToken.Eof(currentSpan()));
        return tokens;
    }

    private SmtToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (c == '(') {
            advance();
            return new SmtToken.LParen(span(start));
        }
        if (c == ')') {
            advance();
            return new SmtToken.RParen(span(start));
        }
        if (c == '"') {
            return scanStringLiteral(start);
        }
        if (c == '|') {
            return scanQuotedSymbol(start);
        }
        if (c == ':') {
            return scanKeyword(start);
        }
        if (c == '#') {
            return scanRadix(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (isSymbolStart(c)) {
            return new SmtToken.Symbol(span(start), scanWhile(SmtLexer::isSymbolPart), false);
        }
        advance();
        return new SmtToken.Error(span(start), "Unexpected character: " + printable(c));
    }

    private SmtToken scanStringLiteral(SourceLocation start) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        boolean backslashQuotes = StringLiterals.usesBackslashQuotes(dialect);
        while (!isAtEnd()) {
            char c = peek();
            if (backslashQuotes && c == '\\' && pos + 1 < input.length()) {
                sb.append(advance());
                sb.append(advance());
                continue;
            }
            if (c == '"') {
                if (!backslashQuotes && pos + 1 < input.length() && input.charAt(pos + 1) == '"') {
                    sb.append(advance());
                    sb.append(advance());
                    continue;
                }
                advance();
                // skip closing quote
                return new SmtToken.StringLiteral(span(start), StringLiterals.decode(sb.toString(), dialect));
            }
            sb.append(advance());
        }
        return new SmtToken.Error(span(start), "Unterminated string literal");
    }

    private SmtToken scanQuotedSymbol(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(advance());
        while (!isAtEnd() && peek() != '|') {
            if (peek() == '\\') {
                return new SmtToken.Error(span(start), "Backslash in quoted symbol");
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            return new SmtToken.Error(span(start), "Unterminated quoted symbol");
        }
        sb.append(advance());
        return new SmtToken.Symbol(span(start), sb.toString(), true);
    }

    private SmtToken scanKeyword(SourceLocation start) {
        advance();
        // skip :
        var name = scanWhile(SmtLexer::isSymbolPart);
        if (name.isEmpty()) {
            return new SmtToken.Error(span(start), "Empty keyword");
        }
        return new SmtToken.Keyword(span(start), ":" + name);
    }

    private SmtToken scanRadix(SourceLocation start) {
        advance();
        // skip #
        if (isAtEnd()) {
            return new SmtToken.Error(span(start), "Incomplete radix constant");
        }
        char radix = advance();
        String digits;
        if (radix == 'x') {
            digits = scanWhile(c -> Character.digit(c, 16) >= 0);
        } else if (radix == 'b') {
            digits = scanWhile(c -> c == '0' || c == '1');
        } else {
            return new SmtToken.Error(span(start), "Unknown radix '#" + printable(radix) + "'");
        }
        if (digits.isEmpty()) {
            return new SmtToken.Error(span(start), "Missing digits in radix constant");
        }
        return new SmtToken.Radix(span(start), "#" + radix + digits, radix == 'x');
    }

    private SmtToken scanNumber(SourceLocation start) {
        var integral = scanWhile(SmtLexer::isDigit);
        if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
            advance();
            var fraction = scanWhile(SmtLexer::isDigit);
            return new SmtToken.Decimal(span(start), integral + "." + fraction);
        }
        return new SmtToken.Numeral(span(start), integral);
    }

    private String scanWhile(CharPredicate predicate) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && predicate.test(peek())) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == ';') {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        } else {
            column++ ;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isSymbolStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || SYMBOL_PUNCTUATION.indexOf(c) >= 0;
    }

    private static boolean isSymbolPart(char c) {
        return isSymbolStart(c) || isDigit(c);
    }

    private static String printable(char c) {
        return c < 0x20 || c == 0x7F
               ? String.format("\\x%02x", (int) c)
               : String.valueOf(c);
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }
}
