package org.pragmatica.smtfuzz.generator;

import org.pragmatica.smtfuzz.dialect.Builtin;
import org.pragmatica.smtfuzz.dialect.Dialect;
import org.pragmatica.smtfuzz.dialect.StringLiterals;
import org.pragmatica.smtfuzz.tree.Node;

import java.util.List;

/**
 * Serializes nodes into SMT-LIB text of a chosen dialect.
 * The inverse of {@link org.pragmatica.smtfuzz.parser.SmtParser}: parsing the output
 * with the same dialect yields structurally equal nodes.
 */
public final class SmtGenerator {
    private final GeneratorConfig config;
    private final Dialect dialect;

    private SmtGenerator(GeneratorConfig config) {
        this.config = config;
        this.dialect = config.dialect();
    }

    public static SmtGenerator create(GeneratorConfig config) {
        return new SmtGenerator(config);
    }

    public static String generate(List<Node> nodes, Dialect dialect) {
        return create(GeneratorConfig.of(dialect)).generate(nodes);
    }

    /**
     * One top-level command per line, each line terminated by the configured separator.
     */
    public String generate(List<Node> nodes) {
        var sb = new StringBuilder();
        for (var node : nodes) {
            generateNode(node, sb);
            sb.append(config.lineSeparator());
        }
        return sb.toString();
    }

    /**
     * A single node without line separator.
     */
    public String generate(Node node) {
        var sb = new StringBuilder();
        generateNode(node, sb);
        return sb.toString();
    }

    private void generateNode(Node node, StringBuilder sb) {
        if (node instanceof Node.Expression expression) {
            generateExpression(expression, sb);
        } else if (node instanceof Node.MetaCommand meta) {
            generateMetaCommand(meta, sb);
        } else {
            generateSetting((Node.Setting) node, sb);
        }
    }

    private void generateSetting(Node.Setting setting, StringBuilder sb) {
        sb.append('(').append(setting.command());
        setting.attribute()
               .ifPresent(attribute -> sb.append(' ').append(attribute));
        setting.value()
               .ifPresent(value -> {
                   sb.append(' ');
                   generateNode(value, sb);
               });
        sb.append(')');
    }

    private void generateMetaCommand(Node.MetaCommand meta, StringBuilder sb) {
        sb.append('(').append(meta.command());
        generateChildren(meta.arguments(), sb);
        sb.append(')');
    }

    private void generateExpression(Node.Expression expression, StringBuilder sb) {
        switch (expression.kind()) {
            case SYMBOL -> sb.append(lexeme(expression.symbol()));
            case KEYWORD, DECIMAL_LITERAL, HEX_LITERAL, BINARY_LITERAL -> sb.append(expression.symbol());
            case INTEGER_LITERAL -> generateInteger(expression.symbol(), sb);
            case STRING_LITERAL -> sb.append(StringLiterals.encode(expression.symbol(), dialect));
            case APPLICATION, RE_RANGE, STR_TO_RE -> generateApplication(expression, sb);
            case LIST -> {
                sb.append('(');
                generateChildren(expression.children(), sb);
                sb.append(')');
            }
        }
    }

    private void generateInteger(String value, StringBuilder sb) {
        if (value.startsWith("-")) {
            // numerals are non-negative; negative values come from multiply
            sb.append('(').append(Builtin.MINUS.lexeme(dialect)).append(' ').append(value, 1, value.length()).append(')');
        } else {
            sb.append(value);
        }
    }

    private void generateApplication(Node.Expression expression, StringBuilder sb) {
        var builtin = Builtin.fromCanonical(expression.symbol());
        var children = expression.children();
        if (builtin.isPresent() && builtin.get().swapsOperands(dialect) && children.size() == 2) {
            children = List.of(children.get(1), children.get(0));
        }
        sb.append('(').append(builtin.map(b -> b.lexeme(dialect)).orElse(expression.symbol()));
        generateChildren(children, sb);
        sb.append(')');
    }

    private void generateChildren(List<Node> children, StringBuilder sb) {
        boolean first = sb.charAt(sb.length() - 1) == '(';
        for (var child : children) {
            if (!first) {
                sb.append(' ');
            }
            first = false;
            generateNode(child, sb);
        }
    }

    private String lexeme(String symbol) {
        return Builtin.fromCanonical(symbol)
                      .map(builtin -> builtin.lexeme(dialect))
                      .orElse(symbol);
    }
}
