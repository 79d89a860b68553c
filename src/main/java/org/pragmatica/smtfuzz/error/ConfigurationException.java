package org.pragmatica.smtfuzz.error;

/**
 * An operator, dialect or option value outside its domain. Raised before any tree is touched.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
