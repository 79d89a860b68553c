package org.pragmatica.smtfuzz.tree;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.List;

/**
 * Address of a node inside a top-level sequence: the index of the top-level
 * node followed by child indices from there down.
 */
public record NodePath(int root, List<Integer> steps) {
    public NodePath {
        steps = ImmutableList.copyOf(steps);
    }

    public static NodePath top(int root) {
        return new NodePath(root, List.of());
    }

    public NodePath child(int index) {
        return new NodePath(root, ImmutableList.<Integer>builder()
                                               .addAll(steps)
                                               .add(index)
                                               .build());
    }

    @Override
    public String toString() {
        return root + (steps.isEmpty() ? "" : "/" + Ints.join("/", Ints.toArray(steps)));
    }
}
