package org.pragmatica.smtfuzz.dialect;

import org.pragmatica.smtfuzz.error.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Lexical convention of the string theory. All dialects share one tree shape.
 */
public enum Dialect {
    /**
     * Legacy Z3-str convention ({@code Concat}, {@code Str2Reg}, {@code RegexIn}), backslash escapes.
     */
    SMT20("smt20"),
    /**
     * SMT-LIB 2.5 string draft ({@code str.in.re}, {@code str.to.re}), {@code \xNN} escapes.
     */
    SMT25("smt25"),
    /**
     * SMT-LIB 2.6 ({@code str.in_re}, {@code str.to_re}), braced unicode escapes.
     */
    SMT26("smt26");

    public static final Dialect OLD = SMT20;
    public static final Dialect NEW = SMT25;

    private final String cliName;

    Dialect(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    public static Dialect fromName(String name) {
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (var dialect : values()) {
            if (dialect.cliName.equals(normalized)) {
                return dialect;
            }
        }
        throw new ConfigurationException("Unknown language '" + name + "', expected one of " + names());
    }

    public static String names() {
        return Arrays.stream(values())
                     .map(Dialect::cliName)
                     .collect(Collectors.joining(", "));
    }
}
