package org.pragmatica.smtfuzz.tree;

import com.google.common.collect.ImmutableList;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Parsed SMT-LIB problem node. Nodes are immutable; a subtree may appear in
 * several trees at once.
 */
public sealed interface Node {
    String INDEXED_HEAD = "_";

    /**
     * Solver configuration directive: {@code set-logic}, {@code set-option}, {@code set-info}.
     */
    record Setting(
    String command,
    Optional<String> attribute,
    Optional<Node> value) implements Node {
        public Setting {
            checkNotNull(command, "command");
            checkNotNull(attribute, "attribute");
            checkNotNull(value, "value");
        }
    }

    /**
     * Structural directive without assertion content: {@code check-sat}, {@code push}, {@code pop}, ...
     */
    record MetaCommand(
    String command,
    List<Node> arguments) implements Node {
        public MetaCommand {
            checkNotNull(command, "command");
            arguments = ImmutableList.copyOf(arguments);
        }
    }

    /**
     * Everything else: top-level assertions, declarations and queries, and every term below them.
     *
     * <p>For literals {@code symbol} holds the literal value; for {@link ExpressionKind#LIST} it is empty.
     */
    record Expression(
    ExpressionKind kind,
    String symbol,
    List<Node> children) implements Node {
        public Expression {
            checkNotNull(kind, "kind");
            checkNotNull(symbol, "symbol");
            children = ImmutableList.copyOf(children);
            checkArgument(!kind.isAtom() || children.isEmpty(), "%s '%s' cannot have children", kind, symbol);
            checkArgument(kind != ExpressionKind.RE_RANGE || children.size() == 2, "re.range takes two arguments");
            checkArgument(kind != ExpressionKind.STR_TO_RE || children.size() == 1, "str.to_re takes one argument");
            checkArgument(kind != ExpressionKind.LIST || symbol.isEmpty(), "list nodes have no head symbol");
        }

        public boolean is(ExpressionKind expected) {
            return kind == expected;
        }

        public Node child(int index) {
            return children.get(index);
        }

        public Expression withChildren(List<Node> newChildren) {
            return new Expression(kind, symbol, newChildren);
        }

        /**
         * {@code (_ name index*)}; the indices are numerals, not terms.
         */
        public boolean isIndexedIdentifier() {
            return kind == ExpressionKind.APPLICATION && INDEXED_HEAD.equals(symbol);
        }

        public Expression withSymbol(String newSymbol) {
            return new Expression(kind, newSymbol, children);
        }

        @Override
        public String toString() {
            if (children.isEmpty() && kind != ExpressionKind.LIST && kind != ExpressionKind.APPLICATION) {
                return kind == ExpressionKind.STRING_LITERAL
                       ? '"' + symbol + '"'
                       : symbol;
            }
            var sb = new StringBuilder("(").append(symbol);
            for (var child : children) {
                if (sb.length() > 1) {
                    sb.append(' ');
                }
                sb.append(child);
            }
            return sb.append(')').toString();
        }
    }

    static Expression symbol(String name) {
        return new Expression(ExpressionKind.SYMBOL, name, List.of());
    }

    static Expression keyword(String name) {
        return new Expression(ExpressionKind.KEYWORD, name, List.of());
    }

    static Expression integer(BigInteger value) {
        return new Expression(ExpressionKind.INTEGER_LITERAL, value.toString(), List.of());
    }

    static Expression integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    static Expression string(String value) {
        return new Expression(ExpressionKind.STRING_LITERAL, value, List.of());
    }

    static Expression apply(String symbol, Node... children) {
        return apply(symbol, List.of(children));
    }

    static Expression apply(String symbol, List<Node> children) {
        return new Expression(ExpressionKind.APPLICATION, symbol, children);
    }

    static Expression list(Node... children) {
        return new Expression(ExpressionKind.LIST, "", List.of(children));
    }
}
