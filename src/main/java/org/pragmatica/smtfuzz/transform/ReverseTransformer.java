package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableList;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.List;
import java.util.Random;

/**
 * Reverses the order of the top-level commands.
 */
public final class ReverseTransformer implements Transformer {
    @Override
    public TransformerType type() {
        return TransformerType.REVERSE;
    }

    @Override
    public List<Node> transform(List<Node> nodes, Random random) {
        return ImmutableList.copyOf(nodes).reverse();
    }
}
