package work.mkly.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the command line.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /** Value understood by the {@code org.slf4j.simpleLogger.defaultLogLevel} property. */
    public String simpleLoggerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
