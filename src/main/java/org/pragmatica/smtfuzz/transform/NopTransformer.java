package org.pragmatica.smtfuzz.transform;

import org.pragmatica.smtfuzz.tree.Node;

import java.util.List;
import java.util.Random;

/**
 * Identity. Used to check that a problem survives the parse and generate round trip.
 */
public final class NopTransformer implements Transformer {
    @Override
    public TransformerType type() {
        return TransformerType.NOP;
    }

    @Override
    public List<Node> transform(List<Node> nodes, Random random) {
        return nodes;
    }
}
