package com.objecty.util;

import com.objecty.debug.Debug;

/** Depth check shared by the recursive walks. */
final class DepthGuard {

    private static final String TAG = "objecty.depth";

    private final String operation;
    private final int maxDepth;

    DepthGuard(String operation, int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        this.operation = operation;
        this.maxDepth = maxDepth;
    }

    void check(int depth) {
        if (depth > maxDepth) {
            Debug.get().w(TAG, operation + " gave up at depth " + depth);
            throw new RecursionLimitException(operation, maxDepth);
        }
    }
}
