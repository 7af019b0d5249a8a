/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.api.model;

/**
 * How the progress of the search is measured for the search-progress forecaster.
 */
public enum ProgressMeasure {
    /**
     * Sum of engine-provided fixed leaf probabilities.
     */
    FIXED('f'),

    /**
     * One minus the current primal-dual gap.
     */
    GAP('g'),

    /**
     * Sum of engine-provided node probabilities based on branching ratios.
     */
    RATIO('r'),

    /**
     * Sum of {@code 2^-depth} over visited leaves.
     */
    UNIFORM('u');

    private final char code;

    ProgressMeasure(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static ProgressMeasure fromCode(char code) {
        for (ProgressMeasure measure : values()) {
            if (measure.code == code) {
                return measure;
            }
        }
        throw new IllegalArgumentException("Unknown progress measure '" + code + "', expected one of f, g, r, u");
    }
}
