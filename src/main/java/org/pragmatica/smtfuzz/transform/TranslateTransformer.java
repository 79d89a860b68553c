package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.smtfuzz.dialect.Builtin;
import org.pragmatica.smtfuzz.dialect.Sort;
import org.pragmatica.smtfuzz.tree.ExpressionKind;
import org.pragmatica.smtfuzz.tree.Node;
import org.pragmatica.smtfuzz.tree.Trees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Renames declared symbols and re-encodes string literals through one random
 * permutation of printable ASCII.
 */
public final class TranslateTransformer implements Transformer {
    private static final Logger LOG = Logger.getLogger(TranslateTransformer.class.getName());

    static final int FIRST_PRINTABLE = 0x20;
    static final int LAST_PRINTABLE = 0x7E;

    private final TransformerOptions.Translate options;

    TranslateTransformer(TransformerOptions.Translate options) {
        this.options = options;
    }

    @Override
    public TransformerType type() {
        return TransformerType.TRANSLATE;
    }

    @Override
    public List<Node> transform(List<Node> nodes, Random random) {
        var permutation = permutation(random);
        var renames = renames(nodes);
        LOG.fine(() -> "Renaming " + renames.size() + " declared symbols");
        var translation = new Translation(renames, permutation);
        return nodes.stream()
                    .map(node -> node instanceof Node.Expression expression
                                 ? translation.rewrite(expression, ImmutableSet.of())
                                 : node)
                    .collect(ImmutableList.toImmutableList());
    }

    /**
     * Fresh name for every renamable declaration, in declaration order.
     */
    Map<String, String> renames(List<Node> nodes) {
        var generator = new NameGenerator(Trees.symbols(nodes));
        var renames = new LinkedHashMap<String, String>();
        for (var declaration : Declarations.of(nodes).all()) {
            if (Builtin.fromCanonical(declaration.name()).isPresent()) {
                continue;
            }
            if (declaration.sort() == Sort.INT && !options.integerFlag()) {
                continue;
            }
            renames.put(declaration.name(), generator.next());
        }
        return ImmutableMap.copyOf(renames);
    }

    /**
     * Maps each printable ASCII character to another, as an array indexed by {@code c - FIRST_PRINTABLE}.
     */
    static int[] permutation(Random random) {
        var shuffled = new ArrayList<Integer>();
        for (int c = FIRST_PRINTABLE; c <= LAST_PRINTABLE; c++) {
            shuffled.add(c);
        }
        Collections.shuffle(shuffled, random);
        return shuffled.stream().mapToInt(Integer::intValue).toArray();
    }

    static String translate(String value, int[] permutation) {
        var sb = new StringBuilder(value.length());
        value.codePoints()
             .map(c -> c >= FIRST_PRINTABLE && c <= LAST_PRINTABLE ? permutation[c - FIRST_PRINTABLE] : c)
             .forEach(sb::appendCodePoint);
        return sb.toString();
    }

    private final class Translation {
        private final Map<String, String> renames;
        private final int[] permutation;

        Translation(Map<String, String> renames, int[] permutation) {
            this.renames = renames;
            this.permutation = permutation;
        }

        Node.Expression rewrite(Node.Expression expression, Set<String> shadowed) {
            return switch (expression.kind()) {
                case SYMBOL -> expression.withSymbol(rename(expression.symbol(), shadowed));
                case STRING_LITERAL -> Node.string(translate(expression.symbol(), permutation));
                case RE_RANGE -> options.skipReRange()
                                 ? expression
                                 : expression.withChildren(rewriteAll(expression.children(), 0, shadowed));
                case STR_TO_RE, LIST -> expression.withChildren(rewriteAll(expression.children(), 0, shadowed));
                case APPLICATION -> rewriteApplication(expression, shadowed);
                case KEYWORD, INTEGER_LITERAL, DECIMAL_LITERAL, HEX_LITERAL, BINARY_LITERAL -> expression;
            };
        }

        private Node.Expression rewriteApplication(Node.Expression application, Set<String> shadowed) {
            var children = application.children();
            if (Binders.isDefinition(application)) {
                // name, parameters, sort, body
                var rewritten = new ArrayList<Node>(children);
                rewritten.set(0, rewriteChild(children.get(0), shadowed));
                rewritten.set(3, rewriteChild(children.get(3), shadow(application, shadowed)));
                return application.withChildren(rewritten);
            }
            if ("declare-fun".equals(application.symbol()) && !children.isEmpty()) {
                var rewritten = new ArrayList<Node>(children);
                rewritten.set(0, rewriteChild(children.get(0), shadowed));
                return application.withChildren(rewritten);
            }
            if (Binders.isBinder(application)) {
                var binderList = Binders.isLet(application)
                                 ? rewriteLetBindings(children.get(0), shadowed)
                                 : children.get(0);
                var rewritten = new ArrayList<Node>();
                rewritten.add(binderList);
                rewritten.addAll(rewriteAll(children, 1, shadow(application, shadowed)));
                return application.withChildren(rewritten);
            }
            return new Node.Expression(application.kind(),
                                       rename(application.symbol(), shadowed),
                                       rewriteAll(children, 0, shadowed));
        }

        // let binds in parallel: values are read in the enclosing scope
        private Node rewriteLetBindings(Node binderList, Set<String> shadowed) {
            if (!(binderList instanceof Node.Expression list) || !list.is(ExpressionKind.LIST)) {
                return binderList;
            }
            var entries = new ArrayList<Node>();
            for (var entry : list.children()) {
                if (entry instanceof Node.Expression binding && binding.is(ExpressionKind.APPLICATION)) {
                    entries.add(binding.withChildren(rewriteAll(binding.children(), 0, shadowed)));
                } else {
                    entries.add(entry);
                }
            }
            return list.withChildren(entries);
        }

        private List<Node> rewriteAll(List<Node> children, int from, Set<String> shadowed) {
            var rewritten = new ArrayList<Node>(children.size() - from);
            for (int i = from; i < children.size(); i++) {
                rewritten.add(rewriteChild(children.get(i), shadowed));
            }
            return rewritten;
        }

        private Node rewriteChild(Node child, Set<String> shadowed) {
            return child instanceof Node.Expression expression
                   ? rewrite(expression, shadowed)
                   : child;
        }

        private Set<String> shadow(Node.Expression binder, Set<String> shadowed) {
            var inner = new HashSet<>(shadowed);
            Binders.bindings(binder).forEach(binding -> inner.add(binding.name()));
            return inner;
        }

        private String rename(String symbol, Set<String> shadowed) {
            if (shadowed.contains(symbol)) {
                return symbol;
            }
            return renames.getOrDefault(symbol, symbol);
        }
    }
}
