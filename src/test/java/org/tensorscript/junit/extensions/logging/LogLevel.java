package org.tensorscript.junit.extensions.logging;

/**
 * The log levels the log-watch annotations can refer to.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
