package org.pragmatica.smtfuzz.tree;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * Structural utilities over node sequences. Every operation returns new
 * sequences and nodes; inputs are never modified.
 */
public final class Trees {

    /**
     * A node together with its address.
     */
    public record Entry(NodePath path, Node node) {}

    private Trees() {}

    public static List<Node> children(Node node) {
        if (node instanceof Node.Expression expression) {
            return expression.children();
        }
        if (node instanceof Node.MetaCommand meta) {
            return meta.arguments();
        }
        var setting = (Node.Setting) node;
        return setting.value()
                      .map(List::of)
                      .orElse(List.of());
    }

    public static Node withChildren(Node node, List<Node> children) {
        if (node instanceof Node.Expression expression) {
            return expression.withChildren(children);
        }
        if (node instanceof Node.MetaCommand meta) {
            return new Node.MetaCommand(meta.command(), children);
        }
        var setting = (Node.Setting) node;
        return new Node.Setting(setting.command(), setting.attribute(), children.stream().findFirst());
    }

    /**
     * All nodes of the sequence in pre-order with their paths.
     */
    public static List<Entry> preOrder(List<Node> nodes) {
        var entries = new ArrayList<Entry>();
        for (int i = 0; i < nodes.size(); i++) {
            collect(NodePath.top(i), nodes.get(i), entries);
        }
        return entries;
    }

    /**
     * All nodes below and including {@code node}, paths relative to {@code path}.
     */
    public static List<Entry> preOrder(NodePath path, Node node) {
        var entries = new ArrayList<Entry>();
        collect(path, node, entries);
        return entries;
    }

    private static void collect(NodePath path, Node node, List<Entry> entries) {
        entries.add(new Entry(path, node));
        var children = children(node);
        for (int i = 0; i < children.size(); i++) {
            collect(path.child(i), children.get(i), entries);
        }
    }

    public static Node get(List<Node> nodes, NodePath path) {
        checkElementIndex(path.root(), nodes.size(), "root");
        var current = nodes.get(path.root());
        for (int step : path.steps()) {
            var children = children(current);
            checkElementIndex(step, children.size(), "step");
            current = children.get(step);
        }
        return current;
    }

    /**
     * New sequence in which the node at {@code path} is replaced by {@code replacement}.
     */
    public static List<Node> replace(List<Node> nodes, NodePath path, Node replacement) {
        checkElementIndex(path.root(), nodes.size(), "root");
        var result = new ArrayList<>(nodes);
        result.set(path.root(), replaceRec(nodes.get(path.root()), path.steps(), 0, replacement));
        return ImmutableList.copyOf(result);
    }

    private static Node replaceRec(Node current, List<Integer> steps, int depth, Node replacement) {
        if (depth == steps.size()) {
            return replacement;
        }
        var children = new ArrayList<>(children(current));
        int index = steps.get(depth);
        checkElementIndex(index, children.size(), "step");
        children.set(index, replaceRec(children.get(index), steps, depth + 1, replacement));
        return withChildren(current, children);
    }

    /**
     * Deep copy producing fresh instances for every node of the subtree.
     */
    public static Node copy(Node node) {
        var children = children(node);
        var copied = new ArrayList<Node>(children.size());
        for (var child : children) {
            copied.add(copy(child));
        }
        if (node instanceof Node.Expression expression) {
            return new Node.Expression(expression.kind(), expression.symbol(), copied);
        }
        if (node instanceof Node.MetaCommand meta) {
            return new Node.MetaCommand(meta.command(), copied);
        }
        var setting = (Node.Setting) node;
        return new Node.Setting(setting.command(), setting.attribute(), copied.stream().findFirst());
    }

    /**
     * Every identifier used in the sequence: bare symbols and application heads.
     */
    public static Set<String> symbols(List<Node> nodes) {
        var symbols = new LinkedHashSet<String>();
        for (var entry : preOrder(nodes)) {
            if (entry.node() instanceof Node.Expression expression
                && (expression.is(ExpressionKind.SYMBOL) || expression.kind().isApplication())) {
                symbols.add(expression.symbol());
            }
        }
        return symbols;
    }
}
