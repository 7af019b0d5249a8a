/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.estimation;

/**
 * Holt's double exponential smoothing of a scalar stream.
 *
 * <p>Level and trend are {@link Double#NaN} until the first sample arrives. The trend is
 * read downstream as a per-sample velocity.
 */
public final class DoubleExpSmooth {

    private final double alpha;
    private final double beta;
    private boolean useTrendInLevel;

    private double level = Double.NaN;
    private double trend = Double.NaN;
    private double initialValue;
    private int n;

    /**
     * @param alpha        level smoothing constant in [0, 1]
     * @param beta         trend smoothing constant in [0, 1]
     * @param initialValue value the first trend is measured against
     */
    public DoubleExpSmooth(double alpha, double beta, double initialValue) {
        if (alpha < 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be between 0 and 1: " + alpha);
        }
        if (beta < 0 || beta > 1) {
            throw new IllegalArgumentException("beta must be between 0 and 1: " + beta);
        }
        this.alpha = alpha;
        this.beta = beta;
        this.useTrendInLevel = true;
        reset(initialValue);
    }

    public void reset(double initialValue) {
        this.initialValue = initialValue;
        this.level = Double.NaN;
        this.trend = Double.NaN;
        this.n = 0;
    }

    public void update(double x) {
        if (n == 0) {
            level = x;
            trend = x - initialValue;
            n = 1;
            return;
        }
        double newLevel = alpha * x + (1 - alpha) * (level + (useTrendInLevel ? trend : 0.0));
        double newTrend = beta * (newLevel - level) + (1 - beta) * trend;
        level = newLevel;
        trend = newTrend;
        n++;
    }

    /**
     * @return the smoothed trend, or {@link Double#NaN} before the first sample
     */
    public double getTrend() {
        return n > 0 ? trend : Double.NaN;
    }

    public double getLevel() {
        return n > 0 ? level : Double.NaN;
    }

    public int getCount() {
        return n;
    }

    public double getInitialValue() {
        return initialValue;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    public boolean isUseTrendInLevel() {
        return useTrendInLevel;
    }

    public void setUseTrendInLevel(boolean useTrendInLevel) {
        this.useTrendInLevel = useTrendInLevel;
    }
}
