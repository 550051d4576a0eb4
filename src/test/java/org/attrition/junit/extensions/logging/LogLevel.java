package org.attrition.junit.extensions.logging;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
