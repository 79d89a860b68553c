package org.pragmatica.smtfuzz.transform;

import org.pragmatica.smtfuzz.error.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The mutation operators.
 */
public enum TransformerType {
    NOP,
    REVERSE,
    ROTATE,
    MULTIPLY,
    GRAFT,
    TRANSLATE,
    FUZZ,
    UNPRINTABLE;

    public String cliName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the input goes through {@link FilteringPolicy} first. Only {@link #NOP} sees raw input.
     */
    public boolean filtersInput() {
        return this != NOP;
    }

    public static TransformerType fromName(String name) {
        var normalized = name.trim().toUpperCase(Locale.ROOT);
        for (var type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new ConfigurationException("Unknown transformer '" + name + "', expected one of " + names());
    }

    public static String names() {
        return Arrays.stream(values())
                     .map(TransformerType::cliName)
                     .collect(Collectors.joining(", "));
    }
}
