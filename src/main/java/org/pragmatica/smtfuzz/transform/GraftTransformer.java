package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.smtfuzz.dialect.Sort;
import org.pragmatica.smtfuzz.tree.Commands;
import org.pragmatica.smtfuzz.tree.ExpressionKind;
import org.pragmatica.smtfuzz.tree.Node;
import org.pragmatica.smtfuzz.tree.NodePath;
import org.pragmatica.smtfuzz.tree.Trees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Replaces one subterm of an assertion by a copy of another subterm of the same sort.
 *
 * <p>Positions are proper descendants of {@code assert} commands. Binder lists, keywords,
 * parenthesised lists and indexed identifiers with their indices are never positions. A donor that mentions a locally bound
 * name stays where it is, since the name may be unbound at the recipient.
 */
public final class GraftTransformer implements Transformer {
    private static final Logger LOG = Logger.getLogger(GraftTransformer.class.getName());

    private final TransformerOptions.Graft options;

    GraftTransformer(TransformerOptions.Graft options) {
        this.options = options;
    }

    /**
     * A graftable position.
     *
     * @param usesLocals Whether the subtree mentions a name bound by an enclosing binder
     */
    record Candidate(NodePath path, Node.Expression node, Sort sort, boolean usesLocals) {}

    @Override
    public TransformerType type() {
        return TransformerType.GRAFT;
    }

    @Override
    public List<Node> transform(List<Node> nodes, Random random) {
        var candidates = candidates(nodes);
        var recipients = new ArrayList<>(candidates);
        Collections.shuffle(recipients, random);
        for (var recipient : recipients) {
            var donors = candidates.stream()
                                   .filter(donor -> donor.sort() == recipient.sort())
                                   .filter(donor -> !donor.usesLocals())
                                   .filter(donor -> !donor.node().equals(recipient.node()))
                                   .toList();
            if (donors.isEmpty()) {
                continue;
            }
            var donor = donors.get(random.nextInt(donors.size()));
            LOG.fine(() -> "Grafting " + donor.path() + " onto " + recipient.path() + " (" + recipient.sort() + ")");
            return Trees.replace(nodes, recipient.path(), Trees.copy(donor.node()));
        }
        LOG.fine("No compatible graft pair, problem left unchanged");
        return nodes;
    }

    /**
     * Every position of known sort, in document order.
     */
    List<Candidate> candidates(List<Node> nodes) {
        var inference = new SortInference(Declarations.of(nodes));
        var candidates = new ArrayList<Candidate>();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) instanceof Node.Expression command
                && command.is(ExpressionKind.APPLICATION)
                && Commands.ASSERT.equals(command.symbol())) {
                var path = NodePath.top(i);
                for (int c = 0; c < command.children().size(); c++) {
                    collect(path.child(c), command.child(c), ImmutableMap.of(), inference, candidates);
                }
            }
        }
        return candidates;
    }

    private void collect(NodePath path,
                         Node node,
                         Map<String, Sort> scope,
                         SortInference inference,
                         List<Candidate> candidates) {
        if (!(node instanceof Node.Expression expression)) {
            return;
        }
        if (expression.isIndexedIdentifier()) {
            return;
        }
        if (options.skipStrToRe() && expression.is(ExpressionKind.STR_TO_RE)) {
            return;
        }
        if (!expression.is(ExpressionKind.LIST) && !expression.is(ExpressionKind.KEYWORD)) {
            var sort = inference.infer(expression, scope);
            if (sort.isKnown()) {
                candidates.add(new Candidate(path, expression, sort, mentions(expression, scope)));
            }
        }
        var inner = scope;
        int first = 0;
        if (Binders.isBinder(expression)) {
            inner = inference.enter(expression, scope);
            first = 1;
        }
        for (int c = first; c < expression.children().size(); c++) {
            collect(path.child(c), expression.child(c), inner, inference, candidates);
        }
    }

    private static boolean mentions(Node.Expression expression, Map<String, Sort> scope) {
        if (scope.isEmpty()) {
            return false;
        }
        for (var entry : Trees.preOrder(NodePath.top(0), expression)) {
            if (entry.node() instanceof Node.Expression inner
                && (inner.is(ExpressionKind.SYMBOL) || inner.is(ExpressionKind.APPLICATION))
                && scope.containsKey(inner.symbol())) {
                return true;
            }
        }
        return false;
    }
}
