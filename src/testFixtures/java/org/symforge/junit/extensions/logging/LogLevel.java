package org.symforge.junit.extensions.logging;

/**
 * Log levels the log-watch annotations can refer to.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
