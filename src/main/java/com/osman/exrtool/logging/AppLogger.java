package com.osman.exrtool.logging;

import java.io.UnsupportedEncodingException;
import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the shared logger configuration for the merge tool.
 */
public final class AppLogger {
    static final String LEVEL_PROPERTY = "exrtool.logLevel";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger("com.osman.exrtool.ExrTool");
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s [%s] %s%n".formatted(
                    record.getLevel().getName(),
                    Thread.currentThread().getName(),
                    formatMessage(record));
                if (record.getThrown() != null) {
                    line += "    " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        var originalOut = System.out;
        StreamHandler consoleHandler = new StreamHandler(originalOut, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (UnsupportedEncodingException ignored) {
            // fall back to platform default when UTF-8 is unavailable
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(resolveLevel(logger));
        return logger;
    }

    static Level parseLevel(String value) {
        if (value == null || value.isBlank()) {
            return Level.INFO;
        }
        return Level.parse(value.trim().toUpperCase(Locale.ROOT));
    }

    private static Level resolveLevel(Logger logger) {
        String configured = System.getProperty(LEVEL_PROPERTY);
        try {
            return parseLevel(configured);
        } catch (IllegalArgumentException ex) {
            logger.warning("Unknown log level '" + configured + "', using INFO");
            return Level.INFO;
        }
    }
}
