package com.objecty.debug;

/** Pluggable debug output target (stdout, a logging bridge, a test collector, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
