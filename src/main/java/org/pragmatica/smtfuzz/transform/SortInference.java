package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.smtfuzz.dialect.Builtin;
import org.pragmatica.smtfuzz.dialect.Sort;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.HashMap;
import java.util.Map;

/**
 * Best-effort sort of a term, from literals, built-in signatures, top-level
 * declarations and the locally bound names in scope.
 */
final class SortInference {
    private static final String ANNOTATION = "!";

    private final Declarations declarations;

    SortInference(Declarations declarations) {
        this.declarations = declarations;
    }

    Sort infer(Node node, Map<String, Sort> scope) {
        if (!(node instanceof Node.Expression expression)) {
            return Sort.UNKNOWN;
        }
        return switch (expression.kind()) {
            case INTEGER_LITERAL -> Sort.INT;
            case STRING_LITERAL -> Sort.STRING;
            case RE_RANGE, STR_TO_RE -> Sort.REGLAN;
            case SYMBOL -> symbolSort(expression.symbol(), scope);
            case APPLICATION -> applicationSort(expression, scope);
            case KEYWORD, DECIMAL_LITERAL, HEX_LITERAL, BINARY_LITERAL, LIST -> Sort.UNKNOWN;
        };
    }

    /**
     * Scope inside the body of {@code binder}: {@code let} names take the sort of their
     * value, quantified names the declared sort.
     */
    Map<String, Sort> enter(Node.Expression binder, Map<String, Sort> scope) {
        var inner = new HashMap<>(scope);
        for (var binding : Binders.bindings(binder)) {
            var sort = Binders.isLet(binder)
                       ? infer(binding.value(), scope)
                       : Sort.of(binding.value());
            inner.put(binding.name(), sort);
        }
        return ImmutableMap.copyOf(inner);
    }

    private Sort symbolSort(String symbol, Map<String, Sort> scope) {
        var local = scope.get(symbol);
        if (local != null) {
            return local;
        }
        return Builtin.fromCanonical(symbol)
                      .map(Builtin::result)
                      .orElseGet(() -> declarations.sortOf(symbol));
    }

    private Sort applicationSort(Node.Expression application, Map<String, Sort> scope) {
        if (Binders.isLet(application)) {
            return infer(application.child(application.children().size() - 1), enter(application, scope));
        }
        if (Binders.isBinder(application)) {
            return Sort.BOOL;
        }
        if (ANNOTATION.equals(application.symbol()) && !application.children().isEmpty()) {
            return infer(application.child(0), scope);
        }
        var builtin = Builtin.fromCanonical(application.symbol());
        if (builtin.isPresent()) {
            if (builtin.get() == Builtin.ITE && application.children().size() == 3) {
                return infer(application.child(1), scope);
            }
            return builtin.get().result();
        }
        return declarations.sortOf(application.symbol());
    }
}
