/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.estimation;

/**
 * The predefined search-progress measures tracked as time series.
 *
 * <p>Each kind fixes the value the measure reaches when the search terminates, the value it
 * starts from, and the smoothing constants of its {@link DoubleExpSmooth}.
 */
public enum TimeSeriesKind {
    /** Closeness of primal and dual bound, 1 at optimality. */
    GAP("gap", 1.0, 0.0, 0.6, 0.15),

    /** Sum of {@code 2^-depth} over visited leaves. */
    PROGRESS("progress", 1.0, 0.0, 0.65, 0.15),

    /** Fraction of visited nodes that are leaves, 0.5 for a full binary tree. */
    LEAF_FREQUENCY("leaf-frequency", 0.5, -0.5, 0.3, 0.33),

    /** Subtree-sum-gap, 0 once the tree is closed. */
    SSG("ssg", 0.0, 1.0, 0.6, 0.15),

    /** Number of open nodes. */
    OPEN_NODES("open-nodes", 0.0, 0.0, 0.6, 0.15);

    private final String displayName;
    private final double targetValue;
    private final double initialValue;
    private final double alpha;
    private final double beta;

    TimeSeriesKind(String displayName, double targetValue, double initialValue, double alpha, double beta) {
        this.displayName = displayName;
        this.targetValue = targetValue;
        this.initialValue = initialValue;
        this.alpha = alpha;
        this.beta = beta;
    }

    public String displayName() {
        return displayName;
    }

    public double targetValue() {
        return targetValue;
    }

    public double initialValue() {
        return initialValue;
    }

    public double alpha() {
        return alpha;
    }

    public double beta() {
        return beta;
    }
}
