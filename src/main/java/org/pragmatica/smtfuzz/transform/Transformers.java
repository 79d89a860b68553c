package org.pragmatica.smtfuzz.transform;

import org.pragmatica.smtfuzz.error.ConfigurationException;

/**
 * Factory for the mutation operators.
 */
public final class Transformers {
    private Transformers() {}

    public static Transformer create(TransformerType type) {
        return create(type, TransformerOptions.defaults(type));
    }

    /**
     * @throws ConfigurationException if {@code options} belong to another operator
     */
    public static Transformer create(TransformerType type, TransformerOptions options) {
        if (!options.appliesTo(type)) {
            throw new ConfigurationException(options.getClass().getSimpleName() + " options do not apply to "
                                             + type.cliName());
        }
        return switch (type) {
            case NOP -> new NopTransformer();
            case REVERSE -> new ReverseTransformer();
            case ROTATE -> new RotateTransformer();
            case MULTIPLY -> new MultiplyTransformer((TransformerOptions.Multiply) options);
            case GRAFT -> new GraftTransformer((TransformerOptions.Graft) options);
            case TRANSLATE -> new TranslateTransformer((TransformerOptions.Translate) options);
            case FUZZ -> new FuzzTransformer((TransformerOptions.Fuzz) options);
            case UNPRINTABLE -> new UnprintableTransformer();
        };
    }
}
