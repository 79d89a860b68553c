package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.smtfuzz.dialect.Sort;
import org.pragmatica.smtfuzz.tree.Commands;
import org.pragmatica.smtfuzz.tree.ExpressionKind;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Symbols declared at top level by {@code declare-fun}, {@code declare-const},
 * {@code define-fun} and {@code define-fun-rec}, in document order.
 */
final class Declarations {
    /**
     * @param name Declared symbol
     * @param sort Result sort, {@link Sort#UNKNOWN} for sorts the fuzzer does not model
     */
    record Declaration(String name, Sort sort) {}

    private final ImmutableMap<String, Declaration> byName;

    private Declarations(ImmutableMap<String, Declaration> byName) {
        this.byName = byName;
    }

    static Declarations of(List<Node> nodes) {
        var byName = new LinkedHashMap<String, Declaration>();
        for (var node : nodes) {
            if (node instanceof Node.Expression expression
                && expression.is(ExpressionKind.APPLICATION)
                && Commands.isDeclaration(expression.symbol())) {
                declaration(expression).ifPresent(declaration -> byName.putIfAbsent(declaration.name(), declaration));
            }
        }
        return new Declarations(ImmutableMap.copyOf(byName));
    }

    private static Optional<Declaration> declaration(Node.Expression command) {
        var children = command.children();
        // declare-const name sort; declare-fun name (args) sort; define-fun name (params) sort body
        int sortIndex = "declare-const".equals(command.symbol()) ? 1 : 2;
        if (children.size() <= sortIndex
            || !(children.get(0) instanceof Node.Expression name)
            || !name.is(ExpressionKind.SYMBOL)) {
            return Optional.empty();
        }
        return Optional.of(new Declaration(name.symbol(), Sort.of(children.get(sortIndex))));
    }

    Sort sortOf(String name) {
        var declaration = byName.get(name);
        return declaration == null ? Sort.UNKNOWN : declaration.sort();
    }

    Collection<Declaration> all() {
        return byName.values();
    }
}
