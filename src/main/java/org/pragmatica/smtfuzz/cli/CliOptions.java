package org.pragmatica.smtfuzz.cli;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.smtfuzz.dialect.Dialect;
import org.pragmatica.smtfuzz.error.ConfigurationException;
import org.pragmatica.smtfuzz.transform.TransformerOptions;
import org.pragmatica.smtfuzz.transform.TransformerType;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed command line.
 *
 * @param seed  Absent when the seed should come from the clock
 * @param input Absent when the problem is read from standard input
 */
record CliOptions(Dialect inputDialect,
                  Dialect outputDialect,
                  TransformerType transformer,
                  TransformerOptions options,
                  Optional<Long> seed,
                  boolean verbose,
                  boolean help,
                  Optional<Path> input) {

    /**
     * @throws ConfigurationException for unknown flags, missing or malformed values
     */
    static CliOptions parse(String[] args) {
        var inputDialect = Dialect.NEW;
        var outputDialect = Dialect.NEW;
        var transformer = TransformerType.NOP;
        Optional<Long> seed = Optional.empty();
        var settings = new LinkedHashMap<String, String>();
        boolean verbose = false;
        boolean help = false;
        Optional<Path> input = Optional.empty();

        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            switch (arg) {
                case "--in-lang" -> inputDialect = Dialect.fromName(value(args, ++i, arg));
                case "--out-lang" -> outputDialect = Dialect.fromName(value(args, ++i, arg));
                case "--transformer" -> transformer = TransformerType.fromName(value(args, ++i, arg));
                case "--seed" -> seed = Optional.of(parseSeed(value(args, ++i, arg)));
                case "--option" -> addSetting(value(args, ++i, arg), settings);
                case "--verbose", "-v" -> verbose = true;
                case "--help", "-h" -> help = true;
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new ConfigurationException("Unknown option: " + arg);
                    }
                    if (input.isPresent()) {
                        throw new ConfigurationException("Only one input file may be given, got " + input.get() + " and " + arg);
                    }
                    input = Optional.of(Path.of(arg));
                }
            }
        }
        var options = TransformerOptions.parse(transformer, ImmutableMap.copyOf(settings));
        return new CliOptions(inputDialect, outputDialect, transformer, options, seed, verbose, help, input);
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new ConfigurationException("Missing value for " + flag);
        }
        return args[index];
    }

    private static long parseSeed(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Seed must be an integer, got '" + text + "'", e);
        }
    }

    private static void addSetting(String text, Map<String, String> settings) {
        int eq = text.indexOf('=');
        if (eq <= 0) {
            throw new ConfigurationException("Expected key=value after --option, got '" + text + "'");
        }
        settings.put(text.substring(0, eq).trim(), text.substring(eq + 1));
    }

    static String usage() {
        return """
                Usage: smtfuzz [options] [FILE]
                  --in-lang <lang>       Dialect of the input: %s (default: smt25)
                  --out-lang <lang>      Dialect of the output (default: smt25)
                  --transformer <name>   One of: %s (default: nop)
                  --seed <n>             Random seed (default: current time)
                  --option <key=value>   Operator option: factor, skip-re-range, skip-str-to-re, integer-flag
                  --verbose, -v          Log transform decisions to standard error
                  --help, -h             Show this help
                Reads FILE, or standard input when absent, and writes the mutated problem to standard output.
                """.formatted(Dialect.names(), TransformerType.names());
    }
}
