package com.tyron.editbox.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output of the {@code com.tyron.editbox} loggers via system property:
 * - editbox.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 *
 * {@link #capture(Class)} lets a test assert on what a class logged.
 */
public final class TestLogging {

    private static final String ROOT_LOGGER = "com.tyron.editbox";

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty("editbox.test.logLevel", "INFO"));

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(new CompactFormatter());

        Logger logger = Logger.getLogger(ROOT_LOGGER);
        logger.setLevel(level);
        logger.setUseParentHandlers(false);
        logger.addHandler(console);

        logger.log(Level.INFO, "testLogging configured level=" + level.getName());
    }

    /**
     * Records everything {@code owner}'s logger publishes, at all levels, until closed.
     */
    public static CapturedLogs capture(Class<?> owner) {
        Logger logger = Logger.getLogger(owner.getName());
        CapturedLogs logs = new CapturedLogs(logger, logger.getLevel());
        logger.setLevel(Level.ALL);
        logger.addHandler(logs);
        return logs;
    }

    public static final class CapturedLogs extends Handler implements AutoCloseable {

        private final Logger logger;
        private final Level previousLevel;
        private final List<LogRecord> records = new ArrayList<>();

        private CapturedLogs(Logger logger, Level previousLevel) {
            this.logger = logger;
            this.previousLevel = previousLevel;
            setLevel(Level.ALL);
        }

        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
            logger.removeHandler(this);
            logger.setLevel(previousLevel);
        }

        public List<LogRecord> getRecords() {
            return records;
        }

        public boolean contains(Level level, String fragment) {
            for (LogRecord record : records) {
                if (record.getLevel().equals(level) && record.getMessage() != null && record.getMessage().contains(fragment)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class CompactFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128);
            out.append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName())).append(' ')
                    .append(simpleName(record.getLoggerName())).append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable t = record.getThrown();
            if (t != null) {
                StringWriter sw = new StringWriter();
                t.printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }

    private static Level parseLevel(String raw) {
        if (raw == null) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return Level.INFO;
        }
    }
}
