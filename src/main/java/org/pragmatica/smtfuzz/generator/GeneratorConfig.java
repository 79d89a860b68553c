package org.pragmatica.smtfuzz.generator;

import org.pragmatica.smtfuzz.dialect.Dialect;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Generator configuration options.
 */
public record GeneratorConfig(
    Dialect dialect,
    String lineSeparator
) {
    public static final GeneratorConfig DEFAULT = new GeneratorConfig(Dialect.SMT25, "\n");

    public GeneratorConfig {
        checkNotNull(dialect, "dialect");
        checkNotNull(lineSeparator, "lineSeparator");
    }

    public static GeneratorConfig of(Dialect dialect) {
        return DEFAULT.withDialect(dialect);
    }

    public GeneratorConfig withDialect(Dialect newDialect) {
        return new GeneratorConfig(newDialect, lineSeparator);
    }

    public GeneratorConfig withLineSeparator(String newLineSeparator) {
        return new GeneratorConfig(dialect, newLineSeparator);
    }
}
