/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.estimation;

import com.arbor.restart.api.ISearchEngine;
import com.arbor.restart.runtime.tree.TreeData;
import com.arbor.restart.util.Tolerances;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

/**
 * A named search-progress measure observed at every leaf, with a tree-size estimate derived
 * from its smoothed trend.
 *
 * <p>Samples are kept at a stride of {@link #getResolution()} leaves. When the buffer is full
 * every second sample is dropped and the stride doubles, so the whole history is retained in
 * constant memory.
 *
 * <p>{@link #estimate(TreeData)} returns {@code -1} when no estimate is available.
 */
public final class TimeSeries {

    public static final int DEFAULT_CAPACITY = 1024;

    /** Weight of a new estimate in the smoothed estimate. */
    static final double SMOOTH_ESTIMATE_WEIGHT = 0.75;

    private static final double TARGET_TOLERANCE = 1e-6;

    private final TimeSeriesKind kind;
    private final int capacity;
    private final Tolerances tolerances;
    private final DoubleExpSmooth des;
    private final DoubleArrayList vals;
    private final DoubleArrayList estimation;

    private double smoothEstim;
    private double currentValue;
    private long nobs;
    private int resolution;

    public TimeSeries(TimeSeriesKind kind, Tolerances tolerances) {
        this(kind, DEFAULT_CAPACITY, tolerances);
    }

    public TimeSeries(TimeSeriesKind kind, int capacity, Tolerances tolerances) {
        if (capacity < 2 || capacity % 2 != 0) {
            throw new IllegalArgumentException("capacity must be a positive even number: " + capacity);
        }
        this.kind = kind;
        this.capacity = capacity;
        this.tolerances = tolerances;
        this.des = new DoubleExpSmooth(kind.alpha(), kind.beta(), kind.initialValue());
        this.vals = new DoubleArrayList(capacity);
        this.estimation = new DoubleArrayList(capacity);
        reset();
    }

    public void reset() {
        des.reset(kind.initialValue());
        vals.clear();
        estimation.clear();
        smoothEstim = Double.NaN;
        currentValue = kind.initialValue();
        nobs = 0L;
        resolution = 1;
    }

    /**
     * Observes the measure after a node event and records it if the node was a leaf.
     */
    public void update(ISearchEngine engine, TreeData treeData, boolean isLeaf) {
        record(observe(engine, treeData), treeData, isLeaf);
    }

    /**
     * Records an already computed observation.
     */
    public void record(double value, TreeData treeData, boolean isLeaf) {
        currentValue = value;
        if (!isLeaf) {
            return;
        }
        nobs++;

        if (nobs % resolution == 0) {
            vals.add(value);
            des.update(value);
            double estimate = estimate(treeData);
            estimation.add(estimate);
            updateSmoothEstimation(estimate);
        }

        if (vals.size() == capacity) {
            resample();
        }
    }

    double observe(ISearchEngine engine, TreeData treeData) {
        switch (kind) {
            case GAP:
                return observeGap(engine);
            case PROGRESS:
                return treeData.getProgress();
            case LEAF_FREQUENCY:
                return treeData.getNvisited() == 0
                        ? -0.5
                        : (treeData.getNleaves() - 0.5) / treeData.getNvisited();
            case SSG:
                return treeData.getNvisited() == 0 ? 1.0 : treeData.getSsg().getValue();
            case OPEN_NODES:
                return treeData.getNvisited() == 0 ? 0.0 : treeData.getNopen();
            default:
                throw new IllegalStateException("Unknown time series kind: " + kind);
        }
    }

    private double observeGap(ISearchEngine engine) {
        if (engine.isInRestart()) {
            return currentValue;
        }
        double primalBound = engine.primalBound();
        double dualBound = engine.dualBound();
        if (tolerances.isInfinite(primalBound) || tolerances.isInfinite(dualBound)) {
            return 0.0;
        }
        if (tolerances.isEqual(primalBound, dualBound)) {
            return 1.0;
        }
        double gap = Math.abs(primalBound - dualBound) / Math.max(Math.abs(primalBound), Math.abs(dualBound));
        return Math.max(1.0 - gap, 0.0);
    }

    /**
     * Tree size at which the trend of this series reaches its target value.
     *
     * @return estimated number of nodes, or {@code -1} before the first leaf
     */
    public double estimate(TreeData treeData) {
        if (nobs == 0L) {
            return -1.0;
        }
        double value = currentValue;
        double target = kind.targetValue();

        if (Math.abs(value - target) <= TARGET_TOLERANCE) {
            return 2.0 * nobs - 1;
        }

        // a trend pointing away from the target falls back to "twice the work done so far"
        double trend = des.getTrend();
        if (Double.isNaN(trend)
                || (target > value && trend < TARGET_TOLERANCE)
                || (target < value && trend > -TARGET_TOLERANCE)) {
            return 2.0 * treeData.getNvisited();
        }

        return 2.0 * resolution * (vals.size() + (target - value) / trend) - 1.0;
    }

    private void updateSmoothEstimation(double estimate) {
        if (Double.isNaN(smoothEstim)) {
            smoothEstim = estimate;
        } else {
            smoothEstim = (1 - SMOOTH_ESTIMATE_WEIGHT) * smoothEstim + SMOOTH_ESTIMATE_WEIGHT * estimate;
        }
    }

    /**
     * Halves the stored history and doubles the sampling stride.
     */
    void resample() {
        int nvals = vals.size();
        if (nvals % 2 != 0) {
            throw new IllegalStateException("resample requires an even number of samples: " + nvals);
        }
        des.reset(kind.initialValue());
        int half = nvals / 2;
        for (int i = 0; i < half; i++) {
            vals.set(i, vals.getDouble(2 * i));
            estimation.set(i, estimation.getDouble(2 * i));
            des.update(vals.getDouble(i));
            updateSmoothEstimation(estimation.getDouble(i));
        }
        vals.size(half);
        estimation.size(half);
        resolution *= 2;
    }

    public TimeSeriesKind getKind() {
        return kind;
    }

    public String getName() {
        return kind.displayName();
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getTargetValue() {
        return kind.targetValue();
    }

    public double getInitialValue() {
        return kind.initialValue();
    }

    /**
     * @return the smoothed trend, or {@link Double#NaN} before the first stored sample
     */
    public double getTrend() {
        return des.getTrend();
    }

    /**
     * @return the smoothed tree-size estimate, or {@link Double#NaN} before the first stored sample
     */
    public double getSmoothEstimation() {
        return smoothEstim;
    }

    public long getNumObservations() {
        return nobs;
    }

    public int getNumValues() {
        return vals.size();
    }

    public int getResolution() {
        return resolution;
    }

    public int getCapacity() {
        return capacity;
    }

    DoubleExpSmooth getDes() {
        return des;
    }

    double[] getValues() {
        return vals.toDoubleArray();
    }

    double[] getEstimations() {
        return estimation.toDoubleArray();
    }
}
