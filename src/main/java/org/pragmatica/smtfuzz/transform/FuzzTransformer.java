package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.smtfuzz.dialect.Builtin;
import org.pragmatica.smtfuzz.dialect.Sort;
import org.pragmatica.smtfuzz.tree.Commands;
import org.pragmatica.smtfuzz.tree.ExpressionKind;
import org.pragmatica.smtfuzz.tree.Node;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Random local perturbation of assertions: literal corruption, operator
 * substitution within a family, and argument swaps.
 */
public final class FuzzTransformer implements Transformer {
    private static final Logger LOG = Logger.getLogger(FuzzTransformer.class.getName());

    /**
     * One in {@code MUTATION_ODDS} visited expressions is perturbed.
     */
    static final int MUTATION_ODDS = 4;

    static final List<BigInteger> INTERESTING = ImmutableList.of(0L, 1L, 16L, 32L, 64L, 127L, 128L, 255L, 256L,
                                                                 512L, 1024L, 4096L)
                                                             .stream()
                                                             .map(BigInteger::valueOf)
                                                             .collect(ImmutableList.toImmutableList());

    private final TransformerOptions.Fuzz options;

    FuzzTransformer(TransformerOptions.Fuzz options) {
        this.options = options;
    }

    @Override
    public TransformerType type() {
        return TransformerType.FUZZ;
    }

    @Override
    public List<Node> transform(List<Node> nodes, Random random) {
        var run = new Run(new SortInference(Declarations.of(nodes)), random);
        var result = new ArrayList<Node>(nodes.size());
        for (var node : nodes) {
            if (node instanceof Node.Expression command
                && command.is(ExpressionKind.APPLICATION)
                && Commands.ASSERT.equals(command.symbol())) {
                result.add(command.withChildren(run.visitAll(command.children(), 0, ImmutableMap.of())));
            } else {
                result.add(node);
            }
        }
        LOG.fine(() -> "Applied " + run.mutations + " mutations");
        return ImmutableList.copyOf(result);
    }

    private final class Run {
        private final SortInference inference;
        private final Random random;
        private int mutations;

        Run(SortInference inference, Random random) {
            this.inference = inference;
            this.random = random;
        }

        List<Node> visitAll(List<Node> children, int from, Map<String, Sort> scope) {
            var visited = new ArrayList<Node>(children);
            for (int i = from; i < children.size(); i++) {
                if (children.get(i) instanceof Node.Expression child) {
                    visited.set(i, visit(child, scope));
                }
            }
            return visited;
        }

        private Node.Expression visit(Node.Expression expression, Map<String, Sort> scope) {
            if (expression.isIndexedIdentifier() || expression.is(ExpressionKind.RE_RANGE) && options.skipReRange()) {
                return expression;
            }
            var current = expression;
            if (!expression.children().isEmpty()) {
                var binder = Binders.isBinder(expression);
                var inner = binder ? inference.enter(expression, scope) : scope;
                // binder lists are kept intact
                current = expression.withChildren(visitAll(expression.children(), binder ? 1 : 0, inner));
            }
            if (random.nextInt(MUTATION_ODDS) != 0) {
                return current;
            }
            return mutate(current, scope);
        }

        private Node.Expression mutate(Node.Expression expression, Map<String, Sort> scope) {
            var choices = new ArrayList<Supplier<Node.Expression>>();
            switch (expression.kind()) {
                case INTEGER_LITERAL -> choices.add(() -> interestingInteger(expression));
                case STRING_LITERAL -> choices.add(() -> Node.string(editString(expression.symbol())));
                case SYMBOL, APPLICATION -> {
                    var builtin = Builtin.fromCanonical(expression.symbol());
                    if (builtin.isPresent() && !builtin.get().siblings().isEmpty()) {
                        var siblings = builtin.get().siblings();
                        choices.add(() -> expression.withSymbol(siblings.get(random.nextInt(siblings.size()))
                                                                        .canonical()));
                    }
                    if (builtin.isPresent() && expression.children().size() >= 2) {
                        var pairs = swappablePairs(builtin.get(), expression, scope);
                        if (!pairs.isEmpty()) {
                            choices.add(() -> swap(expression, pairs.get(random.nextInt(pairs.size()))));
                        }
                    }
                }
                default -> {}
            }
            if (choices.isEmpty()) {
                return expression;
            }
            mutations++ ;
            return choices.get(random.nextInt(choices.size()))
                          .get();
        }

        private Node.Expression interestingInteger(Node.Expression literal) {
            var value = new BigInteger(literal.symbol());
            var candidates = INTERESTING.stream()
                                        .filter(candidate -> !candidate.equals(value))
                                        .toList();
            return Node.integer(candidates.get(random.nextInt(candidates.size())));
        }

        private String editString(String value) {
            var codePoints = new ArrayList<Integer>();
            value.codePoints().forEach(codePoints::add);
            int operation = codePoints.isEmpty() ? 0 : random.nextInt(3);
            switch (operation) {
                case 0 -> codePoints.add(random.nextInt(codePoints.size() + 1), printable());
                case 1 -> codePoints.remove(random.nextInt(codePoints.size()));
                default -> codePoints.set(random.nextInt(codePoints.size()), printable());
            }
            var sb = new StringBuilder();
            codePoints.forEach(sb::appendCodePoint);
            return sb.toString();
        }

        private int printable() {
            return TranslateTransformer.FIRST_PRINTABLE
                   + random.nextInt(TranslateTransformer.LAST_PRINTABLE - TranslateTransformer.FIRST_PRINTABLE + 1);
        }

        private List<int[]> swappablePairs(Builtin builtin, Node.Expression application, Map<String, Sort> scope) {
            var children = application.children();
            var sorts = new ArrayList<Sort>(children.size());
            for (var child : children) {
                sorts.add(inference.infer(child, scope));
            }
            var pairs = new ArrayList<int[]>();
            for (int i = 0; i < children.size(); i++) {
                for (int j = i + 1; j < children.size(); j++) {
                    if (sorts.get(i).isKnown()
                        && sorts.get(i) == sorts.get(j)
                        && builtin.argument(i) == builtin.argument(j)
                        && !children.get(i).equals(children.get(j))) {
                        pairs.add(new int[]{i, j});
                    }
                }
            }
            return pairs;
        }

        private Node.Expression swap(Node.Expression application, int[] pair) {
            var children = new ArrayList<>(application.children());
            var first = children.get(pair[0]);
            children.set(pair[0], children.get(pair[1]));
            children.set(pair[1], first);
            return application.withChildren(children);
        }
    }
}
