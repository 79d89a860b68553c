package org.pragmatica.smtfuzz.parser;

import org.pragmatica.smtfuzz.dialect.Builtin;
import org.pragmatica.smtfuzz.dialect.Dialect;
import org.pragmatica.smtfuzz.error.ParseError;
import org.pragmatica.smtfuzz.error.ParsingException;
import org.pragmatica.smtfuzz.tree.Commands;
import org.pragmatica.smtfuzz.tree.ExpressionKind;
import org.pragmatica.smtfuzz.tree.Node;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Parser for SMT-LIB problem text.
 * Converts the text of one dialect into the dialect-independent node sequence.
 */
public final class SmtParser {
    private static final Logger LOG = Logger.getLogger(SmtParser.class.getName());

    private final List<SmtToken> tokens;
    private final Dialect dialect;
    private int pos;

    private SmtParser(List<SmtToken> tokens, Dialect dialect) {
        this.tokens = tokens;
        this.dialect = dialect;
        this.pos = 0;
    }

    /**
     * Parse problem text into top-level nodes.
     *
     * @throws ParsingException if the text is not well-formed for {@code dialect}
     */
    public static List<Node> parse(String text, Dialect dialect) throws ParsingException {
        var tokens = SmtLexer.tokenize(text, dialect);

        // Check for lexer errors
        for (var token : tokens) {
            if (token instanceof SmtToken.Error error) {
                throw new ParsingException(new ParseError.InvalidToken(error.span().start(), error.message()));
            }
        }

        var nodes = new SmtParser(tokens, dialect).parseScript();
        LOG.fine(() -> "Parsed " + nodes.size() + " top-level nodes as " + dialect.cliName());
        return nodes;
    }

    private List<Node> parseScript() throws ParsingException {
        var nodes = new ArrayList<Node>();
        while (!(peek() instanceof SmtToken.Eof)) {
            nodes.add(parseCommand());
        }
        return Collections.unmodifiableList(nodes);
    }

    private Node parseCommand() throws ParsingException {
        expectLParen("command");
        var head = peek();
        if (!(head instanceof SmtToken.Symbol symbol) || symbol.quoted()) {
            throw unexpected(head, "command name");
        }
        advance();
        var command = symbol.text();
        if (!Commands.isKnown(command)) {
            throw new ParsingException(new ParseError.UnknownCommand(symbol.span().start(), command));
        }
        if (Commands.isSetting(command)) {
            return parseSetting(command);
        }
        var arguments = parseTermsUntilRParen();
        if (Commands.isMeta(command)) {
            return new Node.MetaCommand(command, arguments);
        }
        return new Node.Expression(ExpressionKind.APPLICATION, command, arguments);
    }

    private Node parseSetting(String command) throws ParsingException {
        Optional<String> attribute = Optional.empty();
        if (peek() instanceof SmtToken.Keyword keyword) {
            advance();
            attribute = Optional.of(keyword.text());
        } else if (!command.equals(Commands.SET_LOGIC)) {
            throw unexpected(peek(), "attribute keyword");
        }
        Optional<Node> value = Optional.empty();
        if (!(peek() instanceof SmtToken.RParen)) {
            value = Optional.of(parseTerm());
        } else if (attribute.isEmpty()) {
            throw unexpected(peek(), "logic name");
        }
        expectRParen();
        return new Node.Setting(command, attribute, value);
    }

    private List<Node> parseTermsUntilRParen() throws ParsingException {
        var terms = new ArrayList<Node>();
        while (!(peek() instanceof SmtToken.RParen)) {
            terms.add(parseTerm());
        }
        advance();
        return terms;
    }

    private Node parseTerm() throws ParsingException {
        var token = peek();
        if (token instanceof SmtToken.Eof || token instanceof SmtToken.RParen) {
            throw unexpected(token, "term");
        }
        advance();
        if (token instanceof SmtToken.LParen) {
            return parseParenthesised();
        }
        if (token instanceof SmtToken.Symbol symbol) {
            return Node.symbol(resolve(symbol).map(Builtin::canonical).orElse(symbol.text()));
        }
        if (token instanceof SmtToken.Keyword keyword) {
            return Node.keyword(keyword.text());
        }
        if (token instanceof SmtToken.Numeral numeral) {
            return Node.integer(new BigInteger(numeral.text()));
        }
        if (token instanceof SmtToken.Decimal decimal) {
            return new Node.Expression(ExpressionKind.DECIMAL_LITERAL, decimal.text(), List.of());
        }
        if (token instanceof SmtToken.Radix radix) {
            var kind = radix.hexadecimal() ? ExpressionKind.HEX_LITERAL : ExpressionKind.BINARY_LITERAL;
            return new Node.Expression(kind, radix.text(), List.of());
        }
        var literal = (SmtToken.StringLiteral) token;
        return Node.string(literal.value());
    }

    private Node parseParenthesised() throws ParsingException {
        if (!(peek() instanceof SmtToken.Symbol head)) {
            return new Node.Expression(ExpressionKind.LIST, "", parseTermsUntilRParen());
        }
        advance();
        var builtin = resolve(head);
        var children = parseTermsUntilRParen();
        if (builtin.isEmpty()) {
            return Node.apply(head.text(), children);
        }
        var resolved = builtin.get();
        if (resolved.swapsOperands(head.text(), dialect) && children.size() == 2) {
            Collections.reverse(children);
        }
        return new Node.Expression(kindOf(resolved, children.size()), resolved.canonical(), children);
    }

    private Optional<Builtin> resolve(SmtToken.Symbol symbol) {
        return symbol.quoted()
               ? Optional.empty()
               : Builtin.fromLexeme(symbol.text(), dialect);
    }

    private static ExpressionKind kindOf(Builtin builtin, int arity) {
        if (builtin == Builtin.RE_RANGE && arity == 2) {
            return ExpressionKind.RE_RANGE;
        }
        if (builtin == Builtin.STR_TO_RE && arity == 1) {
            return ExpressionKind.STR_TO_RE;
        }
        return ExpressionKind.APPLICATION;
    }

    private void expectLParen(String context) throws ParsingException {
        if (!(peek() instanceof SmtToken.LParen)) {
            throw unexpected(peek(), "'(' starting a " + context);
        }
        advance();
    }

    private void expectRParen() throws ParsingException {
        if (!(peek() instanceof SmtToken.RParen)) {
            throw unexpected(peek(), "')'");
        }
        advance();
    }

    private ParsingException unexpected(SmtToken token, String expected) {
        if (token instanceof SmtToken.Eof eof) {
            return new ParsingException(new ParseError.UnexpectedEof(eof.span().start(), expected));
        }
        return new ParsingException(new ParseError.UnexpectedInput(token.span().start(), tokenDescription(token), expected));
    }

    private SmtToken peek() {
        return tokens.get(pos);
    }

    private SmtToken advance() {
        var token = tokens.get(pos);
        if (!(token instanceof SmtToken.Eof)) {
            pos++ ;
        }
        return token;
    }

    private static String tokenDescription(SmtToken token) {
        if (token instanceof SmtToken.LParen) {
            return "(";
        }
        if (token instanceof SmtToken.RParen) {
            return ")";
        }
        if (token instanceof SmtToken.Symbol symbol) {
            return symbol.text();
        }
        if (token instanceof SmtToken.Keyword keyword) {
            return keyword.text();
        }
        if (token instanceof SmtToken.Numeral numeral) {
            return numeral.text();
        }
        if (token instanceof SmtToken.Decimal decimal) {
            return decimal.text();
        }
        if (token instanceof SmtToken.Radix radix) {
            return radix.text();
        }
        if (token instanceof SmtToken.StringLiteral) {
            return "string literal";
        }
        return token.getClass().getSimpleName();
    }
}
