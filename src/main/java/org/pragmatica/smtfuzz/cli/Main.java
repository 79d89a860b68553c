package org.pragmatica.smtfuzz.cli;

import org.pragmatica.smtfuzz.SmtFuzz;
import org.pragmatica.smtfuzz.error.ConfigurationException;
import org.pragmatica.smtfuzz.error.ParsingException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line front end: reads one problem, writes its mutation.
 */
public final class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (ConfigurationException e) {
            err.println("error: " + e.getMessage());
            err.print(CliOptions.usage());
            return EXIT_USAGE;
        }
        if (options.help()) {
            out.print(CliOptions.usage());
            return EXIT_OK;
        }
        LoggingConfig.setup(options.verbose() ? Level.FINE : Level.WARNING);

        var builder = SmtFuzz.builder()
                             .inputDialect(options.inputDialect())
                             .outputDialect(options.outputDialect())
                             .transformer(options.transformer())
                             .options(options.options());
        options.seed().ifPresent(builder::seed);
        SmtFuzz fuzz;
        try {
            fuzz = builder.build();
        } catch (ConfigurationException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }
        long seed = fuzz.seed();
        LOG.info(() -> "Using seed " + seed);

        String text;
        try {
            text = options.input().isPresent()
                   ? Files.readString(options.input().get(), StandardCharsets.UTF_8)
                   : new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("error: cannot read " + options.input().map(Object::toString).orElse("standard input")
                        + ": " + e.getMessage());
            return EXIT_IO;
        }

        try {
            out.print(fuzz.fuzz(text));
            out.flush();
        } catch (ParsingException e) {
            var filename = options.input().map(Object::toString).orElse("<stdin>");
            err.print(e.diagnostic().render(text, filename));
            return EXIT_PARSE_ERROR;
        }
        return EXIT_OK;
    }
}
