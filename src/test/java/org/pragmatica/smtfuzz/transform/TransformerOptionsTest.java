package org.pragmatica.smtfuzz.transform;

import org.junit.jupiter.api.Test;
import org.pragmatica.smtfuzz.error.ConfigurationException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformerOptionsTest {

    @Test
    void parse_noSettings_returnsDefaults() {
        for (var type : TransformerType.values()) {
            assertThat(TransformerOptions.parse(type, Map.of())).isEqualTo(TransformerOptions.defaults(type));
        }
        assertThat(TransformerOptions.Multiply.DEFAULT).isEqualTo(new TransformerOptions.Multiply(2, true));
        assertThat(TransformerOptions.Translate.DEFAULT).isEqualTo(new TransformerOptions.Translate(false, true));
    }

    @Test
    void parse_multiplySettings() {
        var options = TransformerOptions.parse(TransformerType.MULTIPLY, Map.of("factor", "-3", "skip-re-range", "false"));

        assertThat(options).isEqualTo(new TransformerOptions.Multiply(-3, false));
    }

    @Test
    void parse_translateAndGraftSettings() {
        assertThat(TransformerOptions.parse(TransformerType.TRANSLATE, Map.of("integer-flag", "yes")))
            .isEqualTo(new TransformerOptions.Translate(true, true));
        assertThat(TransformerOptions.parse(TransformerType.GRAFT, Map.of("skip-str-to-re", "off")))
            .isEqualTo(new TransformerOptions.Graft(false));
    }

    @Test
    void parse_unknownKey_isRejected() {
        assertThatThrownBy(() -> TransformerOptions.parse(TransformerType.FUZZ, Map.of("speed", "1")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("speed");
    }

    @Test
    void parse_keyOfAnotherOperator_isRejected() {
        assertThatThrownBy(() -> TransformerOptions.parse(TransformerType.GRAFT, Map.of("factor", "2")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("graft");
        assertThatThrownBy(() -> TransformerOptions.parse(TransformerType.ROTATE, Map.of("factor", "2")))
            .hasMessageContaining("takes no options");
    }

    @Test
    void parse_malformedValues_areRejected() {
        assertThatThrownBy(() -> TransformerOptions.parse(TransformerType.MULTIPLY, Map.of("factor", "two")))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> TransformerOptions.parse(TransformerType.FUZZ, Map.of("skip-re-range", "maybe")))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void parse_factorOutOfRange_isRejected() {
        assertThatThrownBy(() -> TransformerOptions.parse(TransformerType.MULTIPLY, Map.of("factor", "-2147483648")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("between -1024 and 1024");
        assertThatThrownBy(() -> TransformerOptions.parse(TransformerType.MULTIPLY, Map.of("factor", "1025")))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> TransformerOptions.Multiply.DEFAULT.withFactor(Integer.MIN_VALUE))
            .isInstanceOf(ConfigurationException.class);
        assertThat(TransformerOptions.parse(TransformerType.MULTIPLY, Map.of("factor", "-1024")))
            .isEqualTo(new TransformerOptions.Multiply(-TransformerOptions.Multiply.MAX_FACTOR, true));
    }

    @Test
    void create_withOptionsOfAnotherOperator_isRejected() {
        assertThatThrownBy(() -> Transformers.create(TransformerType.GRAFT, TransformerOptions.Multiply.DEFAULT))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> Transformers.create(TransformerType.MULTIPLY, TransformerOptions.None.INSTANCE))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void create_returnsOperatorOfRequestedType() {
        for (var type : TransformerType.values()) {
            assertThat(Transformers.create(type).type()).isEqualTo(type);
        }
    }

    @Test
    void transformerType_fromName() {
        assertThat(TransformerType.fromName("Graft")).isEqualTo(TransformerType.GRAFT);
        assertThat(TransformerType.NOP.filtersInput()).isFalse();
        assertThat(TransformerType.REVERSE.filtersInput()).isTrue();
        assertThatThrownBy(() -> TransformerType.fromName("shuffle"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("unprintable");
    }
}
