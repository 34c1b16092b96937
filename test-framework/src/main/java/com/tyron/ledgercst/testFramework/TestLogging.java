package com.tyron.ledgercst.testFramework;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.LogRecord;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output via system property:
 * - ledgercst.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 *
 * FINE shows one line per built tree and per settings load.
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "ledgercst.test.logLevel";

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        String raw = System.getProperty(LEVEL_PROPERTY, "INFO");
        Level level = parseLevel(raw);

        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(new CompactFormatter());
            }
        }

        root.log(Level.FINE, "testLogging configured level=" + level.getName() + " raw=" + raw);
    }

    static Level parseLevel(String raw) {
        if (raw == null || raw.isBlank()) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            Logger.getLogger(TestLogging.class.getName())
                    .warning("testLogging unknown level=" + raw + ", using INFO");
            return Level.INFO;
        }
    }

    /**
     * {@code HH:mm:ss.SSS LEVEL SimpleName - message}
     */
    private static final class CompactFormatter extends Formatter {

        private static final DateTimeFormatter TIME = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128);
            out.append(TIME.format(Instant.ofEpochMilli(record.getMillis()))).append(' ');
            String level = record.getLevel().getName();
            out.append(level);
            for (int i = level.length(); i < 7; i++) {
                out.append(' ');
            }
            out.append(' ').append(simpleName(record.getLoggerName()))
                    .append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable thrown = record.getThrown();
            if (thrown != null) {
                StringWriter sw = new StringWriter();
                thrown.printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            String simple = loggerName.substring(loggerName.lastIndexOf('.') + 1);
            int dollar = simple.indexOf('$');
            return dollar >= 0 ? simple.substring(0, dollar) : simple;
        }
    }
}
