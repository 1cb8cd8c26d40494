package com.tyron.lylex.testFramework;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup for the {@code com.tyron.lylex} loggers.
 *
 * The level comes from the system property {@value #LEVEL_PROPERTY} (INFO by default); at FINE
 * every document edit logs its re-lexed and reused line counts. Tests that assert on log output
 * use {@link #capture(Class, Level)}.
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "lylex.test.logLevel";

    static final String LOGGER_NAME = "com.tyron.lylex";

    private static boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY));
        Logger.getLogger(LOGGER_NAME).setLevel(level);
        for (Handler h : Logger.getLogger("").getHandlers()) {
            if (h instanceof ConsoleHandler && h.getLevel().intValue() > level.intValue()) {
                h.setLevel(level);
            }
        }
    }

    static Level parseLevel(String raw) {
        if (raw == null || raw.isBlank()) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    /**
     * Starts recording the messages the logger of {@code owner} writes at {@code level} or above.
     * Close the capture to stop.
     */
    public static LogCapture capture(Class<?> owner, Level level) {
        return new LogCapture(Logger.getLogger(owner.getName()), level);
    }

    /**
     * Messages recorded from one logger, in order.
     */
    public static final class LogCapture extends Handler implements AutoCloseable {

        private final Logger logger;
        private final Level previousLevel;
        private final List<String> messages = Collections.synchronizedList(new ArrayList<>());

        private LogCapture(Logger logger, Level level) {
            this.logger = logger;
            this.previousLevel = logger.getLevel();
            setLevel(level);
            logger.setLevel(level);
            logger.addHandler(this);
        }

        @Override
        public void publish(LogRecord record) {
            if (isLoggable(record)) {
                messages.add(record.getMessage());
            }
        }

        public List<String> getMessages() {
            synchronized (messages) {
                return List.copyOf(messages);
            }
        }

        /**
         * @return the recorded messages starting with {@code prefix}
         */
        public List<String> getMessages(String prefix) {
            List<String> result = new ArrayList<>();
            for (String message : getMessages()) {
                if (message.startsWith(prefix)) {
                    result.add(message);
                }
            }
            return result;
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
            logger.removeHandler(this);
            logger.setLevel(previousLevel);
        }
    }
}
