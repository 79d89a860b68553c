package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableList;
import org.pragmatica.smtfuzz.tree.Commands;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.List;

/**
 * Removes the commands a mutated problem must not carry: settings, solver
 * commands and model or info queries.
 */
public final class FilteringPolicy {
    private FilteringPolicy() {}

    public static boolean shouldKeep(Node node) {
        if (node instanceof Node.Expression expression) {
            return !Commands.isQuery(expression.symbol());
        }
        return false;
    }

    /**
     * Kept nodes in their original order. {@code filter(filter(x)).equals(filter(x))}.
     */
    public static List<Node> filter(List<Node> nodes) {
        return nodes.stream()
                    .filter(FilteringPolicy::shouldKeep)
                    .collect(ImmutableList.toImmutableList());
    }
}
