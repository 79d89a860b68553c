package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.smtfuzz.tree.ExpressionKind;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.List;

/**
 * Local name introduction: {@code let}, {@code forall}, {@code exists} and the
 * parameter lists of {@code define-fun}.
 *
 * <p>A binder list such as {@code ((x 1) (y "a"))} parses as a {@link ExpressionKind#LIST}
 * of applications whose head is the bound name and whose single child is the value or sort.
 */
final class Binders {
    static final String LET = "let";
    static final ImmutableSet<String> QUANTIFIERS = ImmutableSet.of("forall", "exists");
    static final ImmutableSet<String> DEFINITIONS = ImmutableSet.of("define-fun", "define-fun-rec");

    /**
     * One bound name with the term (for {@code let}) or sort (otherwise) it is bound to.
     */
    record Binding(String name, Node value) {}

    private Binders() {}

    static boolean isBinder(Node.Expression expression) {
        return expression.is(ExpressionKind.APPLICATION)
               && (LET.equals(expression.symbol()) || QUANTIFIERS.contains(expression.symbol()))
               && expression.children().size() >= 2;
    }

    static boolean isLet(Node.Expression expression) {
        return isBinder(expression) && LET.equals(expression.symbol());
    }

    static boolean isDefinition(Node.Expression expression) {
        return expression.is(ExpressionKind.APPLICATION)
               && DEFINITIONS.contains(expression.symbol())
               && expression.children().size() >= 4;
    }

    /**
     * Names introduced by a binder, or by the parameter list of a definition.
     */
    static List<Binding> bindings(Node.Expression expression) {
        var list = isDefinition(expression)
                   ? expression.child(1)
                   : expression.child(0);
        var bindings = ImmutableList.<Binding>builder();
        for (var element : elements(list)) {
            if (element instanceof Node.Expression entry
                && entry.is(ExpressionKind.APPLICATION)
                && entry.children().size() == 1) {
                bindings.add(new Binding(entry.symbol(), entry.child(0)));
            }
        }
        return bindings.build();
    }

    /**
     * Elements of a parenthesised form. {@code (String Int)} parses as an application
     * headed by {@code String}; its elements are the head followed by the arguments.
     */
    static List<Node> elements(Node node) {
        if (!(node instanceof Node.Expression expression)) {
            return List.of();
        }
        if (expression.is(ExpressionKind.LIST)) {
            return expression.children();
        }
        if (expression.kind().isApplication()) {
            return ImmutableList.<Node>builder()
                                .add(Node.symbol(expression.symbol()))
                                .addAll(expression.children())
                                .build();
        }
        return List.of(node);
    }
}
