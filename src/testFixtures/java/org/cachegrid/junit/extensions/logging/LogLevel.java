package org.cachegrid.junit.extensions.logging;

/**
 * Log levels the watch annotations can refer to. DEBUG and TRACE are never validated.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
