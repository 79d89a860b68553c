package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableList;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Rotates the top-level commands left by a random offset.
 */
public final class RotateTransformer implements Transformer {
    private static final Logger LOG = Logger.getLogger(RotateTransformer.class.getName());

    @Override
    public TransformerType type() {
        return TransformerType.ROTATE;
    }

    @Override
    public List<Node> transform(List<Node> nodes, Random random) {
        if (nodes.size() < 2) {
            return ImmutableList.copyOf(nodes);
        }
        int offset = random.nextInt(nodes.size());
        LOG.fine(() -> "Rotating " + nodes.size() + " commands by " + offset);
        return by(nodes, offset);
    }

    /**
     * Left rotation by {@code offset}, taken modulo the size; negative offsets rotate right.
     */
    public static List<Node> by(List<Node> nodes, int offset) {
        if (nodes.isEmpty()) {
            return ImmutableList.of();
        }
        int k = Math.floorMod(offset, nodes.size());
        return ImmutableList.<Node>builder()
                            .addAll(nodes.subList(k, nodes.size()))
                            .addAll(nodes.subList(0, k))
                            .build();
    }
}
