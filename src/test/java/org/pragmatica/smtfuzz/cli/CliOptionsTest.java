package org.pragmatica.smtfuzz.cli;

import org.junit.jupiter.api.Test;
import org.pragmatica.smtfuzz.dialect.Dialect;
import org.pragmatica.smtfuzz.error.ConfigurationException;
import org.pragmatica.smtfuzz.transform.TransformerOptions;
import org.pragmatica.smtfuzz.transform.TransformerType;

import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliOptionsTest {

    @Test
    void parse_noArguments_usesDefaults() {
        var options = CliOptions.parse(new String[0]);

        assertThat(options.inputDialect()).isEqualTo(Dialect.SMT25);
        assertThat(options.outputDialect()).isEqualTo(Dialect.SMT25);
        assertThat(options.transformer()).isEqualTo(TransformerType.NOP);
        assertThat(options.options()).isEqualTo(TransformerOptions.None.INSTANCE);
        assertThat(options.seed()).isEmpty();
        assertThat(options.input()).isEmpty();
        assertThat(options.verbose()).isFalse();
    }

    @Test
    void parse_allFlags() {
        var options = CliOptions.parse(new String[]{"--in-lang", "smt20", "--out-lang", "smt26", "--transformer", "multiply",
                                                    "--option", "factor=5", "--option", "skip-re-range=false",
                                                    "--seed", "7", "-v", "problem.smt2"});

        assertThat(options.inputDialect()).isEqualTo(Dialect.SMT20);
        assertThat(options.outputDialect()).isEqualTo(Dialect.SMT26);
        assertThat(options.options()).isEqualTo(new TransformerOptions.Multiply(5, false));
        assertThat(options.seed()).isEqualTo(Optional.of(7L));
        assertThat(options.verbose()).isTrue();
        assertThat(options.input()).contains(Path.of("problem.smt2"));
    }

    @Test
    void parse_invalidArguments_areRejected() {
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--bogus"})).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--seed"})).hasMessageContaining("Missing value");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--seed", "x"})).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--option", "factor"})).hasMessageContaining("key=value");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--option", "factor=2"})).hasMessageContaining("nop");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"a.smt2", "b.smt2"})).hasMessageContaining("one input");
    }
}
