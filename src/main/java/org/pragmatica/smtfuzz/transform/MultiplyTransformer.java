package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableList;
import org.pragmatica.smtfuzz.tree.Node;

import java.math.BigInteger;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Scales every integer literal by a factor and repeats every string literal
 * {@code |factor|} times.
 */
public final class MultiplyTransformer implements Transformer {
    private static final Logger LOG = Logger.getLogger(MultiplyTransformer.class.getName());

    private final TransformerOptions.Multiply options;
    private final BigInteger factor;

    MultiplyTransformer(TransformerOptions.Multiply options) {
        this.options = options;
        this.factor = BigInteger.valueOf(options.factor());
    }

    @Override
    public TransformerType type() {
        return TransformerType.MULTIPLY;
    }

    @Override
    public List<Node> transform(List<Node> nodes, Random random) {
        LOG.fine(() -> "Multiplying literals by " + options.factor());
        return nodes.stream()
                    .map(node -> node instanceof Node.Expression expression ? multiply(expression) : node)
                    .collect(ImmutableList.toImmutableList());
    }

    private Node multiply(Node.Expression expression) {
        return switch (expression.kind()) {
            case INTEGER_LITERAL -> Node.integer(new BigInteger(expression.symbol()).multiply(factor));
            case STRING_LITERAL -> Node.string(expression.symbol().repeat(Math.abs(options.factor())));
            case RE_RANGE -> options.skipReRange() ? expression : multiplyChildren(expression);
            case APPLICATION -> expression.isIndexedIdentifier() ? expression : multiplyChildren(expression);
            case STR_TO_RE, LIST -> multiplyChildren(expression);
            case SYMBOL, KEYWORD, DECIMAL_LITERAL, HEX_LITERAL, BINARY_LITERAL -> expression;
        };
    }

    private Node multiplyChildren(Node.Expression expression) {
        if (expression.children().isEmpty()) {
            return expression;
        }
        return expression.withChildren(expression.children()
                                                 .stream()
                                                 .map(child -> child instanceof Node.Expression inner ? multiply(inner) : child)
                                                 .collect(ImmutableList.toImmutableList()));
    }
}
