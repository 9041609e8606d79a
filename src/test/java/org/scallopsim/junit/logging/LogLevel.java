package org.scallopsim.junit.logging;

import ch.qos.logback.classic.Level;

/**
 * Log levels that {@link LogWatchExtension} can watch for.
 */
public enum LogLevel {
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    Level toLogback() {
        return logbackLevel;
    }
}
