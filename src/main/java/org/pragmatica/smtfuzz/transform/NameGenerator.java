package org.pragmatica.smtfuzz.transform;

import java.util.Set;

/**
 * Fresh identifiers {@code str000001}, {@code str000002}, ... avoiding a set of taken names.
 */
final class NameGenerator {
    private static final String PREFIX = "str";
    private static final int MIN_DIGITS = 6;

    private final Set<String> taken;
    private long counter;

    NameGenerator(Set<String> taken) {
        this.taken = taken;
    }

    String next() {
        String name;
        do {
            counter++;
            name = format(counter);
        } while (taken.contains(name));
        return name;
    }

    private static String format(long value) {
        var numeric = Long.toString(value);
        if (numeric.length() >= MIN_DIGITS) {
            return PREFIX + numeric;
        }
        var sb = new StringBuilder(PREFIX.length() + MIN_DIGITS);
        sb.append(PREFIX);
        for (int i = numeric.length(); i < MIN_DIGITS; i++) {
            sb.append('0');
        }
        return sb.append(numeric).toString();
    }
}
