package org.pragmatica.smtfuzz.transform;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.smtfuzz.error.ConfigurationException;

import java.util.Map;
import java.util.Set;

/**
 * Options of one operator. Each operator has its own record; unknown or
 * foreign settings are rejected when options are built.
 */
public sealed interface TransformerOptions {
    String FACTOR = "factor";
    String SKIP_RE_RANGE = "skip-re-range";
    String SKIP_STR_TO_RE = "skip-str-to-re";
    String INTEGER_FLAG = "integer-flag";

    boolean appliesTo(TransformerType type);

    /**
     * Operators without options: nop, reverse, rotate, unprintable.
     */
    record None() implements TransformerOptions {
        public static final None INSTANCE = new None();

        @Override
        public boolean appliesTo(TransformerType type) {
            return switch (type) {
                case NOP, REVERSE, ROTATE, UNPRINTABLE -> true;
                default -> false;
            };
        }
    }

    /**
     * @param factor      Integer literals are multiplied by it, string literals repeated {@code |factor|} times;
     *                    at most {@link #MAX_FACTOR} in magnitude
     * @param skipReRange Leave regex range nodes untouched
     */
    record Multiply(int factor, boolean skipReRange) implements TransformerOptions {
        public static final int MAX_FACTOR = 1024;
        public static final Multiply DEFAULT = new Multiply(2, true);

        public Multiply {
            if (factor < -MAX_FACTOR || factor > MAX_FACTOR) {
                throw new ConfigurationException("Option '" + FACTOR + "' must be between " + -MAX_FACTOR + " and "
                                                 + MAX_FACTOR + ", got " + factor);
            }
        }

        public Multiply withFactor(int newFactor) {
            return new Multiply(newFactor, skipReRange);
        }

        public Multiply withSkipReRange(boolean skip) {
            return new Multiply(factor, skip);
        }

        @Override
        public boolean appliesTo(TransformerType type) {
            return type == TransformerType.MULTIPLY;
        }
    }

    /**
     * @param skipStrToRe String to regex coercions are neither donors nor recipients
     */
    record Graft(boolean skipStrToRe) implements TransformerOptions {
        public static final Graft DEFAULT = new Graft(true);

        @Override
        public boolean appliesTo(TransformerType type) {
            return type == TransformerType.GRAFT;
        }
    }

    /**
     * @param integerFlag Also rename declarations of sort Int
     * @param skipReRange Keep string literals inside regex ranges untranslated
     */
    record Translate(boolean integerFlag, boolean skipReRange) implements TransformerOptions {
        public static final Translate DEFAULT = new Translate(false, true);

        public Translate withIntegerFlag(boolean flag) {
            return new Translate(flag, skipReRange);
        }

        public Translate withSkipReRange(boolean skip) {
            return new Translate(integerFlag, skip);
        }

        @Override
        public boolean appliesTo(TransformerType type) {
            return type == TransformerType.TRANSLATE;
        }
    }

    /**
     * @param skipReRange Do not perturb regex range nodes
     */
    record Fuzz(boolean skipReRange) implements TransformerOptions {
        public static final Fuzz DEFAULT = new Fuzz(true);

        @Override
        public boolean appliesTo(TransformerType type) {
            return type == TransformerType.FUZZ;
        }
    }

    static TransformerOptions defaults(TransformerType type) {
        return switch (type) {
            case MULTIPLY -> Multiply.DEFAULT;
            case GRAFT -> Graft.DEFAULT;
            case TRANSLATE -> Translate.DEFAULT;
            case FUZZ -> Fuzz.DEFAULT;
            case NOP, REVERSE, ROTATE, UNPRINTABLE -> None.INSTANCE;
        };
    }

    /**
     * Setting keys accepted by {@code type}.
     */
    static Set<String> keys(TransformerType type) {
        return switch (type) {
            case MULTIPLY -> ImmutableSet.of(FACTOR, SKIP_RE_RANGE);
            case GRAFT -> ImmutableSet.of(SKIP_STR_TO_RE);
            case TRANSLATE -> ImmutableSet.of(INTEGER_FLAG, SKIP_RE_RANGE);
            case FUZZ -> ImmutableSet.of(SKIP_RE_RANGE);
            case NOP, REVERSE, ROTATE, UNPRINTABLE -> ImmutableSet.of();
        };
    }

    /**
     * Build options for {@code type} from {@code key=value} settings; absent keys keep their defaults.
     *
     * @throws ConfigurationException for unknown keys, keys of another operator, or malformed values
     */
    static TransformerOptions parse(TransformerType type, Map<String, String> settings) {
        var accepted = keys(type);
        for (var key : settings.keySet()) {
            if (!accepted.contains(key)) {
                throw new ConfigurationException("Option '" + key + "' does not apply to " + type.cliName()
                                                 + (accepted.isEmpty() ? ", which takes no options" : ", expected one of " + accepted));
            }
        }
        return switch (type) {
            case MULTIPLY -> new Multiply(intSetting(settings, FACTOR, Multiply.DEFAULT.factor()),
                                          boolSetting(settings, SKIP_RE_RANGE, Multiply.DEFAULT.skipReRange()));
            case GRAFT -> new Graft(boolSetting(settings, SKIP_STR_TO_RE, Graft.DEFAULT.skipStrToRe()));
            case TRANSLATE -> new Translate(boolSetting(settings, INTEGER_FLAG, Translate.DEFAULT.integerFlag()),
                                            boolSetting(settings, SKIP_RE_RANGE, Translate.DEFAULT.skipReRange()));
            case FUZZ -> new Fuzz(boolSetting(settings, SKIP_RE_RANGE, Fuzz.DEFAULT.skipReRange()));
            case NOP, REVERSE, ROTATE, UNPRINTABLE -> None.INSTANCE;
        };
    }

    private static int intSetting(Map<String, String> settings, String key, int defaultValue) {
        var value = settings.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option '" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean boolSetting(Map<String, String> settings, String key, boolean defaultValue) {
        var value = settings.get(key);
        if (value == null) {
            return defaultValue;
        }
        return switch (value.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> throw new ConfigurationException("Option '" + key + "' must be true or false, got '" + value + "'");
        };
    }
}
