package org.pragmatica.smtfuzz.transform;

import org.junit.jupiter.api.Test;
import org.pragmatica.smtfuzz.dialect.Dialect;
import org.pragmatica.smtfuzz.error.ParsingException;
import org.pragmatica.smtfuzz.parser.SmtParser;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class TranslateTransformerTest {
    private final TranslateTransformer translate = new TranslateTransformer(TransformerOptions.Translate.DEFAULT);

    private static List<Node> parse(String problem) throws ParsingException {
        return SmtParser.parse(problem, Dialect.SMT25);
    }

    private static String literal(Node assertion, int... steps) {
        Node current = assertion;
        for (int step : steps) {
            current = ((Node.Expression) current).child(step);
        }
        return ((Node.Expression) current).symbol();
    }

    @Test
    void transform_renamesStringDeclarationsAndKeepsIntegers() throws ParsingException {
        var nodes = parse("(declare-fun x () String)(declare-const n Int)(assert (= (str.len x) n))");

        var output = translate.transform(nodes, new Random(1));

        assertThat(output).extracting(Node::toString)
                          .containsExactly("(declare-fun str000001 () String)",
                                           "(declare-const n Int)",
                                           "(assert (= (str.len str000001) n))");
    }

    @Test
    void transform_integerFlag_renamesIntegersToo() throws ParsingException {
        var nodes = parse("(declare-fun x () String)(declare-const n Int)(assert (= (str.len x) n))");

        var output = new TranslateTransformer(TransformerOptions.Translate.DEFAULT.withIntegerFlag(true))
            .transform(nodes, new Random(1));

        assertThat(output.get(2).toString()).isEqualTo("(assert (= (str.len str000001) str000002))");
    }

    @Test
    void transform_freshNames_avoidExistingSymbols() throws ParsingException {
        var nodes = parse("(declare-const str000001 String)(declare-const x String)(assert (= x str000001))");

        var output = translate.transform(nodes, new Random(1));

        assertThat(output.get(2).toString()).isEqualTo("(assert (= str000003 str000002))");
    }

    @Test
    void transform_boundNames_shadowDeclarations() throws ParsingException {
        var nodes = parse("(declare-const x String)(assert (let ((x \"\")) (= x \"\")))(assert (= x \"\"))");

        var output = translate.transform(nodes, new Random(1));

        assertThat(output.get(1).toString()).isEqualTo("(assert (let ((x \"\")) (= x \"\")))");
        assertThat(output.get(2).toString()).isEqualTo("(assert (= str000001 \"\"))");
    }

    @Test
    void transform_functionParameters_shadowDeclarations() throws ParsingException {
        var nodes = parse("(declare-const a String)(define-fun g ((a String)) Bool (= a a))(assert (g a))");

        var output = translate.transform(nodes, new Random(1));

        assertThat(output).extracting(Node::toString)
                          .containsExactly("(declare-const str000001 String)",
                                           "(define-fun str000002 ((a String)) Bool (= a a))",
                                           "(assert (str000002 str000001))");
    }

    @Test
    void transform_letValues_seeOuterScope() throws ParsingException {
        var nodes = parse("(declare-const x String)(assert (let ((x x)) (= x \"\")))");

        var output = translate.transform(nodes, new Random(1));

        assertThat(output.get(1).toString()).isEqualTo("(assert (let ((x str000001)) (= x \"\")))");
    }

    @Test
    void transform_stringLiterals_shareOnePermutation() throws ParsingException {
        var nodes = parse("(assert (= x \"hello\"))(assert (= y \"olleh\"))");

        var output = translate.transform(nodes, new Random(17));

        var first = literal(output.get(0), 0, 1);
        var second = literal(output.get(1), 0, 1);
        assertThat(first).hasSize(5);
        assertThat(first.charAt(2)).isEqualTo(first.charAt(3));
        assertThat(second).isEqualTo(new StringBuilder(first).reverse().toString());
    }

    @Test
    void transform_regexRange_keptByDefault() throws ParsingException {
        var nodes = parse("(assert (str.in.re s (re.range \"a\" \"c\")))(assert (= s \"ac\"))");

        var kept = translate.transform(nodes, new Random(23));
        assertThat(literal(kept.get(0), 0, 1, 0)).isEqualTo("a");
        assertThat(literal(kept.get(0), 0, 1, 1)).isEqualTo("c");

        var translated = new TranslateTransformer(TransformerOptions.Translate.DEFAULT.withSkipReRange(false))
            .transform(nodes, new Random(23));
        assertThat(literal(translated.get(0), 0, 1, 0) + literal(translated.get(0), 0, 1, 1))
            .isEqualTo(literal(translated.get(1), 0, 1));
    }

    @Test
    void permutation_isBijectionOverPrintableAscii() {
        var permutation = TranslateTransformer.permutation(new Random(5));

        var sorted = Arrays.stream(permutation).sorted().toArray();
        assertThat(sorted).containsExactly(IntStream.rangeClosed(0x20, 0x7E).toArray());
    }

    @Test
    void translate_keepsCharactersOutsidePrintableAscii() {
        var permutation = TranslateTransformer.permutation(new Random(5));

        assertThat(TranslateTransformer.translate("\u0001é\n", permutation)).isEqualTo("\u0001é\n");
    }

    @Test
    void renames_skipBuiltinNames() throws ParsingException {
        assertThat(translate.renames(parse("(declare-const re.all String)"))).isEmpty();
    }

    @Test
    void nameGenerator_skipsTakenNames() {
        var generator = new NameGenerator(Set.of("str000002"));

        assertThat(generator.next()).isEqualTo("str000001");
        assertThat(generator.next()).isEqualTo("str000003");
    }
}
