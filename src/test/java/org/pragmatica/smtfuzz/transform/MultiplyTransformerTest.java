package org.pragmatica.smtfuzz.transform;

import org.junit.jupiter.api.Test;
import org.pragmatica.smtfuzz.dialect.Dialect;
import org.pragmatica.smtfuzz.error.ParsingException;
import org.pragmatica.smtfuzz.generator.SmtGenerator;
import org.pragmatica.smtfuzz.parser.SmtParser;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class MultiplyTransformerTest {

    private static String multiply(String problem, TransformerOptions.Multiply options) throws ParsingException {
        var transformer = new MultiplyTransformer(options);
        var nodes = SmtParser.parse(problem, Dialect.SMT25);
        return SmtGenerator.generate(transformer.transform(nodes, new Random(0)), Dialect.SMT25);
    }

    @Test
    void transform_scalesIntegersAndRepeatsStrings() throws ParsingException {
        var output = multiply("(assert (= (str.++ x \"ab\") \"c\"))(assert (= (str.len x) 3))",
                              TransformerOptions.Multiply.DEFAULT.withFactor(3));

        assertThat(output).isEqualTo("""
            (assert (= (str.++ x "ababab") "ccc"))
            (assert (= (str.len x) 9))
            """);
    }

    @Test
    void transform_zeroFactor_yieldsZeroAndEmptyString() throws ParsingException {
        var output = multiply("(assert (= (str.len \"abc\") 3))", TransformerOptions.Multiply.DEFAULT.withFactor(0));

        assertThat(output).isEqualTo("(assert (= (str.len \"\") 0))\n");
    }

    @Test
    void transform_negativeFactor_negatesIntegersAndRepeatsStringsByMagnitude() throws ParsingException {
        var output = multiply("(assert (= (str.len \"ab\") 3))", TransformerOptions.Multiply.DEFAULT.withFactor(-2));

        assertThat(output).isEqualTo("(assert (= (str.len \"abab\") (- 6)))\n");
    }

    @Test
    void transform_negativeFactor_leavesLoopIndicesAlone() throws ParsingException {
        var output = multiply(Problems.LOOP, TransformerOptions.Multiply.DEFAULT.withFactor(-2));

        assertThat(output).isEqualTo("""
            (declare-fun x () String)
            (assert (= (str.len x) (- 4)))
            (assert (str.in.re x ((_ re.loop 1 3) (str.to.re "aa"))))
            """);
    }

    @Test
    void transform_unitFactor_isIdentity() throws ParsingException {
        var nodes = SmtParser.parse("(declare-const s String)(assert (= (str.at s 2) \"q\"))", Dialect.SMT25);

        var output = new MultiplyTransformer(TransformerOptions.Multiply.DEFAULT.withFactor(1)).transform(nodes, new Random(0));

        assertThat(output).isEqualTo(nodes);
    }

    @Test
    void transform_arbitraryPrecision() {
        var nodes = List.<Node>of(Node.apply("assert", Node.apply("=", Node.symbol("n"), Node.integer(Long.MAX_VALUE))));

        var output = new MultiplyTransformer(TransformerOptions.Multiply.DEFAULT).transform(nodes, new Random(0));

        assertThat(output.get(0).toString()).isEqualTo("(assert (= n 18446744073709551614))");
    }

    @Test
    void transform_regexRange_skippedByDefault() throws ParsingException {
        var problem = "(assert (str.in.re s (re.union (re.range \"a\" \"c\") (str.to.re \"x\"))))";

        assertThat(multiply(problem, TransformerOptions.Multiply.DEFAULT))
            .isEqualTo("(assert (str.in.re s (re.union (re.range \"a\" \"c\") (str.to.re \"xx\"))))\n");
        assertThat(multiply(problem, TransformerOptions.Multiply.DEFAULT.withSkipReRange(false)))
            .isEqualTo("(assert (str.in.re s (re.union (re.range \"aa\" \"cc\") (str.to.re \"xx\"))))\n");
    }
}
