package org.pragmatica.smtfuzz.error;

import com.google.common.collect.ImmutableList;
import org.pragmatica.smtfuzz.tree.SourceLocation;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Report of a rejected problem, rendered against the problem text:
 * <pre>
 * error: Unknown command 'assrt' at 2:2
 *  --> problem.smt2:2:2
 * 2 | (assrt (= x "a"))
 *   |  ^
 *   = help: top-level forms are assertions, declarations, settings and solver commands
 * </pre>
 *
 * @param message  Primary message
 * @param location Where the offending input starts
 * @param hints    Trailing notes, one per line
 */
public record Diagnostic(String message, SourceLocation location, List<String> hints) {
    static final String UNKNOWN_COMMAND_HELP = "help: top-level forms are assertions, declarations, settings and solver commands";

    public Diagnostic {
        checkNotNull(message, "message");
        checkNotNull(location, "location");
        hints = ImmutableList.copyOf(hints);
    }

    public static Diagnostic of(ParseError error) {
        var diagnostic = error(error.message(), error.location());
        return error instanceof ParseError.UnknownCommand
               ? diagnostic.hint(UNKNOWN_COMMAND_HELP)
               : diagnostic;
    }

    public static Diagnostic error(String message, SourceLocation location) {
        return new Diagnostic(message, location, List.of());
    }

    public Diagnostic hint(String hint) {
        return new Diagnostic(message, location, ImmutableList.<String>builder()
                                                              .addAll(hints)
                                                              .add(hint)
                                                              .build());
    }

    /**
     * Multi-line report quoting the offending line with a caret under the column.
     *
     * @param filename Shown before the location, may be null
     */
    public String render(String source, String filename) {
        var gutter = Integer.toString(location.line());
        var pad = " ".repeat(gutter.length());
        var out = new StringBuilder();
        out.append("error: ").append(message).append('\n');
        out.append(pad).append("--> ").append(where(filename)).append('\n');
        sourceLine(source).ifPresent(text -> out.append(gutter).append(" | ").append(text).append('\n')
                                                .append(pad).append(" | ")
                                                .append(" ".repeat(Math.max(0, location.column() - 1)))
                                                .append("^\n"));
        for (var hint : hints) {
            out.append(pad).append(" = ").append(hint).append('\n');
        }
        return out.toString();
    }

    private String where(String filename) {
        return filename == null
               ? location.toString()
               : filename + ":" + location;
    }

    private Optional<String> sourceLine(String source) {
        if (location.line() < 1) {
            return Optional.empty();
        }
        return source.lines()
                     .skip(location.line() - 1)
                     .findFirst();
    }
}
