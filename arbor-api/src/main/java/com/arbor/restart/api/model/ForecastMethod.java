/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api.model;

/**
 * Forecaster used by {@link RestartPolicy#PROGRESS} to predict the remaining work.
 */
public enum ForecastMethod {
    /** Weighted backtrack estimate minus the nodes already processed. */
    BACKTRACK('b'),

    /** Smoothed progress velocity over the whole history. */
    LINEAR('l'),

    /** Velocity (and optionally acceleration) over a rolling window. */
    WINDOW('w');

    private final char code;

    ForecastMethod(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static ForecastMethod fromCode(char code) {
        for (ForecastMethod method : values()) {
            if (method.code == code) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown forecast method '" + code + "', expected one of b, l, w");
    }
}
