package org.pragmatica.smtfuzz;

import com.google.common.collect.ImmutableList;
import org.pragmatica.smtfuzz.dialect.Dialect;
import org.pragmatica.smtfuzz.error.ConfigurationException;
import org.pragmatica.smtfuzz.error.ParsingException;
import org.pragmatica.smtfuzz.generator.GeneratorConfig;
import org.pragmatica.smtfuzz.generator.SmtGenerator;
import org.pragmatica.smtfuzz.parser.SmtParser;
import org.pragmatica.smtfuzz.transform.FilteringPolicy;
import org.pragmatica.smtfuzz.transform.Transformer;
import org.pragmatica.smtfuzz.transform.TransformerOptions;
import org.pragmatica.smtfuzz.transform.TransformerType;
import org.pragmatica.smtfuzz.transform.Transformers;
import org.pragmatica.smtfuzz.tree.Commands;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Entry point for mutating SMT-LIB string problems.
 *
 * <p>Example usage:
 * <pre>{@code
 * var fuzz = SmtFuzz.builder()
 *                   .inputDialect(Dialect.SMT20)
 *                   .outputDialect(Dialect.SMT26)
 *                   .transformer(TransformerType.MULTIPLY)
 *                   .options(TransformerOptions.Multiply.DEFAULT.withFactor(3))
 *                   .seed(42)
 *                   .build();
 *
 * var mutated = fuzz.fuzz("(declare-fun x () String)(assert (= (str.len x) 3))");
 * }</pre>
 *
 * <p>Parse, filter (for every operator but {@code nop}), transform and generate. A filtered
 * problem that contained {@code (check-sat)} gets a single one appended.
 */
public final class SmtFuzz {
    private static final Logger LOG = Logger.getLogger(SmtFuzz.class.getName());

    private final Dialect inputDialect;
    private final Dialect outputDialect;
    private final TransformerType type;
    private final Transformer transformer;
    private final long seed;

    private SmtFuzz(Dialect inputDialect, Dialect outputDialect, TransformerType type, Transformer transformer, long seed) {
        this.inputDialect = inputDialect;
        this.outputDialect = outputDialect;
        this.type = type;
        this.transformer = transformer;
        this.seed = seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Dialect inputDialect() {
        return inputDialect;
    }

    public Dialect outputDialect() {
        return outputDialect;
    }

    public TransformerType type() {
        return type;
    }

    public long seed() {
        return seed;
    }

    public List<Node> parse(String text) throws ParsingException {
        return SmtParser.parse(text, inputDialect);
    }

    public List<Node> transform(List<Node> nodes) {
        var input = type.filtersInput()
                    ? FilteringPolicy.filter(nodes)
                    : nodes;
        var output = transformer.transform(input, new Random(seed));
        if (type.filtersInput() && hasCheckSat(nodes)) {
            output = ImmutableList.<Node>builder()
                                  .addAll(output)
                                  .add(new Node.MetaCommand(Commands.CHECK_SAT, List.of()))
                                  .build();
        }
        int kept = input.size();
        LOG.info(() -> type.cliName() + ": " + nodes.size() + " commands in, " + kept + " transformed, seed " + seed);
        return output;
    }

    public String generate(List<Node> nodes) {
        return SmtGenerator.create(GeneratorConfig.of(outputDialect))
                           .generate(nodes);
    }

    /**
     * Parse, transform and generate in one step.
     *
     * @throws ParsingException if {@code text} is not well-formed in the input dialect
     */
    public String fuzz(String text) throws ParsingException {
        return generate(transform(parse(text)));
    }

    private static boolean hasCheckSat(List<Node> nodes) {
        return nodes.stream()
                    .anyMatch(node -> node instanceof Node.MetaCommand meta && Commands.CHECK_SAT.equals(meta.command()));
    }

    public static final class Builder {
        private Dialect inputDialect = Dialect.NEW;
        private Dialect outputDialect = Dialect.NEW;
        private TransformerType type = TransformerType.NOP;
        private TransformerOptions options;
        private long seed = System.currentTimeMillis();

        private Builder() {}

        public Builder inputDialect(Dialect dialect) {
            this.inputDialect = dialect;
            return this;
        }

        public Builder outputDialect(Dialect dialect) {
            this.outputDialect = dialect;
            return this;
        }

        public Builder transformer(TransformerType transformerType) {
            this.type = transformerType;
            return this;
        }

        /**
         * Operator options; the operator's defaults when never called.
         */
        public Builder options(TransformerOptions transformerOptions) {
            this.options = transformerOptions;
            return this;
        }

        public Builder seed(long value) {
            this.seed = value;
            return this;
        }

        /**
         * @throws ConfigurationException if the options do not belong to the chosen operator
         */
        public SmtFuzz build() {
            if (inputDialect == null || outputDialect == null || type == null) {
                throw new ConfigurationException("Input language, output language and transformer are required");
            }
            var effective = options == null
                            ? TransformerOptions.defaults(type)
                            : options;
            return new SmtFuzz(inputDialect, outputDialect, type, Transformers.create(type, effective), seed);
        }
    }
}
