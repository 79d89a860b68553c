package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableList;
import org.pragmatica.smtfuzz.tree.ExpressionKind;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Plants one control character in every string literal.
 */
public final class UnprintableTransformer implements Transformer {
    private static final Logger LOG = Logger.getLogger(UnprintableTransformer.class.getName());

    static final int DELETE = 0x7F;

    @Override
    public TransformerType type() {
        return TransformerType.UNPRINTABLE;
    }

    @Override
    public List<Node> transform(List<Node> nodes, Random random) {
        return nodes.stream()
                    .map(node -> node instanceof Node.Expression expression ? plant(expression, random) : node)
                    .collect(ImmutableList.toImmutableList());
    }

    private Node.Expression plant(Node.Expression expression, Random random) {
        if (expression.is(ExpressionKind.STRING_LITERAL)) {
            return Node.string(withControlCharacter(expression.symbol(), random));
        }
        if (expression.children().isEmpty()) {
            return expression;
        }
        var children = new ArrayList<Node>(expression.children().size());
        for (var child : expression.children()) {
            children.add(child instanceof Node.Expression inner ? plant(inner, random) : child);
        }
        return expression.withChildren(children);
    }

    static String withControlCharacter(String value, Random random) {
        int control = controlCharacter(random);
        if (value.isEmpty()) {
            return String.valueOf((char) control);
        }
        var codePoints = value.codePoints().toArray();
        int index = random.nextInt(codePoints.length);
        LOG.finer(() -> "Replacing code point " + index + " by 0x" + Integer.toHexString(control));
        codePoints[index] = control;
        return new String(codePoints, 0, codePoints.length);
    }

    /**
     * Uniform over 0x00-0x1F and 0x7F.
     */
    static int controlCharacter(Random random) {
        int value = random.nextInt(0x21);
        return value == 0x20 ? DELETE : value;
    }
}
