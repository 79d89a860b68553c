package org.pragmatica.smtfuzz.transform;

import org.junit.jupiter.api.Test;
import org.pragmatica.smtfuzz.dialect.Dialect;
import org.pragmatica.smtfuzz.error.ParsingException;
import org.pragmatica.smtfuzz.parser.SmtParser;
import org.pragmatica.smtfuzz.tree.Node;

import static org.assertj.core.api.Assertions.assertThat;

class FilteringPolicyTest {
    private static final String PROBLEM = """
        (set-info :smt-lib-version 2.6)
        (set-logic QF_S)
        (declare-fun x () String)
        (define-fun y () String "a")
        (push 1)
        (assert (= x y))
        (check-sat)
        (get-model)
        (get-value (x))
        (exit)
        """;

    @Test
    void filter_keepsDeclarationsAndAssertionsInOrder() throws ParsingException {
        var filtered = FilteringPolicy.filter(SmtParser.parse(PROBLEM, Dialect.SMT25));

        assertThat(filtered).extracting(node -> ((Node.Expression) node).symbol())
                            .containsExactly("declare-fun", "define-fun", "assert");
    }

    @Test
    void filter_isIdempotent() throws ParsingException {
        var once = FilteringPolicy.filter(SmtParser.parse(PROBLEM, Dialect.SMT25));

        assertThat(FilteringPolicy.filter(once)).isEqualTo(once);
    }

    @Test
    void shouldKeep_rejectsSettingsMetaCommandsAndQueries() throws ParsingException {
        var nodes = SmtParser.parse("(set-option :x 1)(check-sat)(get-info :name)(declare-sort S 0)", Dialect.SMT25);

        assertThat(FilteringPolicy.shouldKeep(nodes.get(0))).isFalse();
        assertThat(FilteringPolicy.shouldKeep(nodes.get(1))).isFalse();
        assertThat(FilteringPolicy.shouldKeep(nodes.get(2))).isFalse();
        assertThat(FilteringPolicy.shouldKeep(nodes.get(3))).isTrue();
    }
}
