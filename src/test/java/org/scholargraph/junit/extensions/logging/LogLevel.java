package org.scholargraph.junit.extensions.logging;

import ch.qos.logback.classic.Level;

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
