/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.estimation;

/**
 * Forecasts the resources (nodes) needed to reach a progress level from a history of
 * {@code (progress, resources)} samples.
 *
 * <p>The most recent {@link #MAX_WINDOW_SIZE} samples are kept in a ring buffer. Every
 * forecast returns the <em>remaining</em> resources, {@code 0} when the target has been
 * reached and {@link Double#POSITIVE_INFINITY} when progress has stalled over a positive
 * amount of resources. Forecasts are {@link Double#NaN} when no velocity or acceleration can
 * be measured, e.g. when the window samples were all taken at the same node count.
 */
public final class WindowForecaster {

    public static final int MAX_WINDOW_SIZE = 500;

    static final double DES_ALPHA = 0.95;
    static final double DES_BETA = 0.10;

    private static final double MIN_ACCELERATION = 1e-9;

    private final double[] progressBuffer = new double[MAX_WINDOW_SIZE];
    private final double[] resourceBuffer = new double[MAX_WINDOW_SIZE];
    private final DoubleExpSmooth desProgress = new DoubleExpSmooth(DES_ALPHA, DES_BETA, 0.0);
    private final DoubleExpSmooth desResources = new DoubleExpSmooth(DES_ALPHA, DES_BETA, 0.0);

    private int curr = -1;
    private long nobservations;

    public void reset() {
        curr = -1;
        nobservations = 0L;
        desProgress.reset(0.0);
        desResources.reset(0.0);
    }

    /**
     * @param progress  progress measured so far
     * @param resources resources spent to reach it, e.g. processed nodes
     */
    public void addSample(double progress, double resources) {
        nobservations++;
        curr = (curr + 1) % MAX_WINDOW_SIZE;
        progressBuffer[curr] = progress;
        resourceBuffer[curr] = resources;

        desProgress.update(progress);
        desResources.update(resources);
    }

    public double getCurrentProgress() {
        return curr == -1 ? 0.0 : progressBuffer[curr];
    }

    public double getCurrentResources() {
        return curr == -1 ? 0.0 : resourceBuffer[curr];
    }

    public long getNumObservations() {
        return nobservations;
    }

    /**
     * Extrapolates the smoothed progress per sample over the whole history. A sample is one
     * leaf, and a binary tree with {@code N} leaves has {@code 2N - 1} nodes.
     */
    public double forecastLinear(double target) {
        double remaining = target - getCurrentProgress();
        if (remaining <= 0.0) {
            return 0.0;
        }
        if (nobservations == 0) {
            return Double.NaN;
        }
        double trend = desProgress.getTrend();
        if (trend == 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        double totalLeaves = remaining / trend + nobservations;
        return 2 * totalLeaves - 1 - getCurrentResources();
    }

    /**
     * Extrapolates the progress velocity over the last {@code windowSize} samples.
     *
     * <p>With {@code useAcceleration} and at least three samples in the window, a quadratic
     * {@code s(x) = s0 + v x + a x^2 / 2} is fitted through the first, middle and last sample,
     * with {@code x} measured from the last sample. The earliest crossing of {@code target} at
     * {@code x >= 0} is returned.
     *
     * @param windowSize number of samples, clamped to the number of observations
     */
    public double forecastWindow(double target, int windowSize, boolean useAcceleration) {
        double remaining = target - getCurrentProgress();
        if (remaining <= 0.0) {
            return 0.0;
        }
        int window = (int) Math.min(Math.min(windowSize, MAX_WINDOW_SIZE), nobservations);
        if (window < 2) {
            return Double.NaN;
        }

        int end = curr;
        int start = Math.floorMod(curr - window + 1, MAX_WINDOW_SIZE);

        if (useAcceleration && window >= 3) {
            int mid = (start + (window - 1) / 2) % MAX_WINDOW_SIZE;
            return forecastQuadratic(target, start, mid, end, remaining);
        }

        return remainingAtVelocity(remaining, velocity(start, end));
    }

    private double forecastQuadratic(double target, int start, int mid, int end, double remaining) {
        double x1 = resourceBuffer[start] - resourceBuffer[end];
        double x2 = resourceBuffer[mid] - resourceBuffer[end];
        double vel1 = velocity(start, mid);
        double velWindow = velocity(start, end);

        // mean velocity over [x1, x] is v + a (x1 + x) / 2
        double acceleration = (velWindow - vel1) / (-x2) * 2.0;
        double v = vel1 - 0.5 * acceleration * (x1 + x2);

        if (Double.isNaN(acceleration)) {
            return Double.NaN;
        }
        if (Math.abs(acceleration) < MIN_ACCELERATION || Double.isInfinite(acceleration)) {
            return remainingAtVelocity(remaining, v);
        }

        double s0 = progressBuffer[start] - v * x1 - 0.5 * acceleration * x1 * x1;
        double discriminant = Math.max(0.0, v * v - 2 * acceleration * (s0 - target));
        double root = Math.sqrt(discriminant);
        double r1 = (-v + root) / acceleration;
        double r2 = (-v - root) / acceleration;

        if (Double.isNaN(r1) || Double.isNaN(r2)) {
            return Double.NaN;
        }
        double first = Math.min(r1, r2);
        double second = Math.max(r1, r2);
        if (first >= 0.0) {
            return first;
        }
        if (second >= 0.0) {
            return second;
        }
        return Double.POSITIVE_INFINITY;
    }

    private double velocity(int t1, int t2) {
        return (progressBuffer[t2] - progressBuffer[t1]) / (resourceBuffer[t2] - resourceBuffer[t1]);
    }

    /**
     * {@code NaN} for an undefined velocity, a negative value when progress went backwards.
     */
    private static double remainingAtVelocity(double remaining, double velocity) {
        if (Double.isNaN(velocity)) {
            return Double.NaN;
        }
        if (velocity == 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return remaining / velocity;
    }

    DoubleExpSmooth getProgressSmoother() {
        return desProgress;
    }

    DoubleExpSmooth getResourceSmoother() {
        return desResources;
    }
}
