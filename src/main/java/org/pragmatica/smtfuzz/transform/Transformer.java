package org.pragmatica.smtfuzz.transform;

import org.pragmatica.smtfuzz.tree.Node;

import java.util.List;
import java.util.Random;

/**
 * A mutation operator. Implementations never modify {@code nodes} and draw all
 * randomness from {@code random}, so a fixed seed reproduces the output.
 */
public interface Transformer {
    TransformerType type();

    List<Node> transform(List<Node> nodes, Random random);
}
