package org.pragmatica.smtfuzz.cli;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Routes the library loggers to standard error, one line per record.
 */
final class LoggingConfig {
    static final String ROOT_LOGGER = "org.pragmatica.smtfuzz";

    private LoggingConfig() {}

    static void setup(Level level) {
        LogManager.getLogManager().reset();

        var handler = new ConsoleHandler();
        handler.setFormatter(new OneLineFormatter());
        handler.setLevel(level);

        var logger = Logger.getLogger(ROOT_LOGGER);
        logger.addHandler(handler);
        logger.setLevel(level);
        logger.setUseParentHandlers(false);
    }

    static final class OneLineFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            var sb = new StringBuilder();
            sb.append(String.format("%s %s: %s%n",
                                    record.getLevel(),
                                    shortName(record.getLoggerName()),
                                    formatMessage(record)));
            var thrown = record.getThrown();
            if (thrown != null) {
                var sw = new StringWriter();
                try (var pw = new PrintWriter(sw)) {
                    thrown.printStackTrace(pw);
                }
                sb.append(sw);
            }
            return sb.toString();
        }

        private static String shortName(String loggerName) {
            if (loggerName == null) {
                return "";
            }
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }
}
