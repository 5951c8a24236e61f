package com.objecty.debug;

/** Severity attached to every message routed through {@link Debug}. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
