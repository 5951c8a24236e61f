package com.objecty.util;

/**
 * Thrown when a recursive walk nests deeper than its configured limit, which in
 * practice means the input graph refers back to itself.
 */
public class RecursionLimitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final int maxDepth;

    public RecursionLimitException(String operation, int maxDepth) {
        super(operation + ": max depth " + maxDepth + " exceeded (cyclic aggregate?)");
        this.operation = operation;
        this.maxDepth = maxDepth;
    }

    public String operation() { return operation; }

    public int maxDepth() { return maxDepth; }
}
