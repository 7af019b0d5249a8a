/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.util;

import com.arbor.restart.api.ISearchEngine;

/**
 * Epsilon-aware floating point comparisons shared by every estimator.
 *
 * <p>Values whose magnitude reaches {@link #infinity()} are treated as infinite.
 */
public final class Tolerances {

    public static final double DEFAULT_INFINITY = 1e20;
    public static final double DEFAULT_EPSILON = 1e-9;

    private static final Tolerances DEFAULT = new Tolerances(DEFAULT_INFINITY, DEFAULT_EPSILON);

    private final double infinity;
    private final double epsilon;

    public Tolerances(double infinity, double epsilon) {
        if (infinity <= 0) {
            throw new IllegalArgumentException("infinity must be positive: " + infinity);
        }
        if (epsilon < 0) {
            throw new IllegalArgumentException("epsilon must not be negative: " + epsilon);
        }
        this.infinity = infinity;
        this.epsilon = epsilon;
    }

    public static Tolerances defaults() {
        return DEFAULT;
    }

    public static Tolerances of(ISearchEngine engine) {
        return new Tolerances(engine.infinity(), engine.epsilon());
    }

    public double infinity() {
        return infinity;
    }

    public double epsilon() {
        return epsilon;
    }

    public boolean isInfinity(double value) {
        return value >= infinity;
    }

    public boolean isInfinite(double value) {
        return Math.abs(value) >= infinity;
    }

    public boolean isFinite(double value) {
        return !isInfinite(value) && !Double.isNaN(value);
    }

    public boolean isEqual(double a, double b) {
        return Math.abs(a - b) <= epsilon;
    }

    public boolean isGT(double a, double b) {
        return a - b > epsilon;
    }

    public boolean isLT(double a, double b) {
        return b - a > epsilon;
    }

    public boolean isZero(double value) {
        return Math.abs(value) <= epsilon;
    }

    /**
     * Relative difference {@code (a - b) / max(|a|, |b|, 1)}.
     */
    public double relDiff(double a, double b) {
        double quot = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        return (a - b) / quot;
    }
}
