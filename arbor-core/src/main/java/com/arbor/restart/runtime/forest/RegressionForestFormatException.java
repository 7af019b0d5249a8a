/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.forest;

/**
 * Thrown when a regression forest file cannot be parsed or describes an invalid forest.
 */
public class RegressionForestFormatException extends Exception {

    private final int lineNumber;

    public RegressionForestFormatException(String message) {
        this(message, -1, null);
    }

    public RegressionForestFormatException(String message, int lineNumber) {
        this(message, lineNumber, null);
    }

    public RegressionForestFormatException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? message + " (line " + lineNumber + ")" : message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * @return 1-based line of the offending input, or {@code -1} if not tied to a line
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
