package org.pragmatica.smtfuzz.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.smtfuzz.dialect.Dialect;

import static org.assertj.core.api.Assertions.assertThat;

class SmtLexerTest {

    @Test
    void tokenize_simpleCommand_producesTokens() {
        var tokens = SmtLexer.tokenize("(assert true)", Dialect.SMT25);

        assertThat(tokens).hasSize(5);
        assertThat(tokens.get(0)).isInstanceOf(SmtToken.LParen.class);
        assertThat(((SmtToken.Symbol) tokens.get(1)).text()).isEqualTo("assert");
        assertThat(((SmtToken.Symbol) tokens.get(2)).text()).isEqualTo("true");
        assertThat(tokens.get(3)).isInstanceOf(SmtToken.RParen.class);
        assertThat(tokens.get(4)).isInstanceOf(SmtToken.Eof.class);
    }

    @Test
    void tokenize_comment_isSkipped() {
        var tokens = SmtLexer.tokenize("; header\n(check-sat) ; trailing", Dialect.SMT25);

        assertThat(tokens).hasSize(4);
        assertThat(((SmtToken.Symbol) tokens.get(1)).text()).isEqualTo("check-sat");
    }

    @Test
    void tokenize_tracksLineAndColumn() {
        var tokens = SmtLexer.tokenize("\n  (x", Dialect.SMT25);

        var start = tokens.get(0).span().start();
        assertThat(start.line()).isEqualTo(2);
        assertThat(start.column()).isEqualTo(3);
        assertThat(start.offset()).isEqualTo(3);
        assertThat(tokens.get(1).span().start().column()).isEqualTo(4);
    }

    @Test
    void tokenize_doubledQuote_inNewerDialects() {
        var tokens = SmtLexer.tokenize("\"a\"\"b\"", Dialect.SMT25);

        assertThat(tokens.get(0)).isInstanceOf(SmtToken.StringLiteral.class);
        assertThat(((SmtToken.StringLiteral) tokens.get(0)).value()).isEqualTo("a\"b");
    }

    @Test
    void tokenize_backslashQuote_inLegacyDialect() {
        var tokens = SmtLexer.tokenize("\"a\\\"b\" x", Dialect.SMT20);

        assertThat(((SmtToken.StringLiteral) tokens.get(0)).value()).isEqualTo("a\"b");
        assertThat(((SmtToken.Symbol) tokens.get(1)).text()).isEqualTo("x");
    }

    @Test
    void tokenize_unterminatedString_producesError() {
        var tokens = SmtLexer.tokenize("(assert \"abc", Dialect.SMT25);

        assertThat(tokens.get(tokens.size() - 2)).isInstanceOf(SmtToken.Error.class);
        assertThat(((SmtToken.Error) tokens.get(tokens.size() - 2)).message()).contains("Unterminated string");
        assertThat(tokens.get(tokens.size() - 1)).isInstanceOf(SmtToken.Eof.class);
    }

    @Test
    void tokenize_numbers() {
        var tokens = SmtLexer.tokenize("42 2.6 #x1F #b101", Dialect.SMT26);

        assertThat(tokens.get(0)).isEqualTo(new SmtToken.Numeral(tokens.get(0).span(), "42"));
        assertThat(tokens.get(1)).isEqualTo(new SmtToken.Decimal(tokens.get(1).span(), "2.6"));
        assertThat(tokens.get(2)).isEqualTo(new SmtToken.Radix(tokens.get(2).span(), "#x1F", true));
        assertThat(tokens.get(3)).isEqualTo(new SmtToken.Radix(tokens.get(3).span(), "#b101", false));
    }

    @Test
    void tokenize_quotedSymbol_keepsBars() {
        var tokens = SmtLexer.tokenize("|a b|", Dialect.SMT25);

        var symbol = (SmtToken.Symbol) tokens.get(0);
        assertThat(symbol.text()).isEqualTo("|a b|");
        assertThat(symbol.quoted()).isTrue();
    }

    @Test
    void tokenize_backslashInQuotedSymbol_producesError() {
        var tokens = SmtLexer.tokenize("|a\\b|", Dialect.SMT25);

        assertThat(tokens.get(0)).isInstanceOf(SmtToken.Error.class);
    }

    @Test
    void tokenize_keyword() {
        var tokens = SmtLexer.tokenize(":named", Dialect.SMT25);

        assertThat(((SmtToken.Keyword) tokens.get(0)).text()).isEqualTo(":named");
    }

    @Test
    void tokenize_oversizedInput_producesError() {
        var tokens = SmtLexer.tokenize("a".repeat(SmtLexer.MAX_INPUT_SIZE + 1), Dialect.SMT25);

        assertThat(tokens).hasSize(2);
        assertThat(((SmtToken.Error) tokens.get(0)).message()).contains("maximum size");
    }
}
