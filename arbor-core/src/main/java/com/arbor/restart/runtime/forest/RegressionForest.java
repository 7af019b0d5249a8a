/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.forest;

import java.util.Arrays;

/**
 * Ensemble of regression trees stored in flat arrays.
 *
 * <p>Node {@code p} is a leaf if {@code splitIdx[p] == -1}, in which case {@code value[p]} is
 * its prediction. Otherwise {@code value[p]} is the split threshold and
 * {@code child[2p]} / {@code child[2p + 1]} are the absolute positions of the left and right
 * child. Instances are immutable.
 */
public final class RegressionForest {

    public static final int MAX_SIZE = 10_000_000;

    private final int ntrees;
    private final int dim;
    private final int size;
    private final int[] nbegin;
    private final int[] child;
    private final int[] splitIdx;
    private final double[] value;

    RegressionForest(int dim, int[] nbegin, int[] child, int[] splitIdx, double[] value) {
        this.ntrees = nbegin.length;
        this.dim = dim;
        this.size = value.length;
        this.nbegin = nbegin;
        this.child = child;
        this.splitIdx = splitIdx;
        this.value = value;
    }

    /**
     * Mean of the leaf values reached in every tree.
     *
     * @param datapoint feature vector with at least {@link #getDimension()} entries
     */
    public double predict(double[] datapoint) {
        if (datapoint.length < dim) {
            throw new IllegalArgumentException(
                    "Data point has dimension " + datapoint.length + ", forest expects " + dim);
        }
        double sum = 0.0;
        for (int tree = 0; tree < ntrees; tree++) {
            int pos = nbegin[tree];
            while (splitIdx[pos] != -1) {
                int goRight = datapoint[splitIdx[pos]] > value[pos] ? 1 : 0;
                pos = child[2 * pos + goRight];
            }
            sum += value[pos];
        }
        return sum / ntrees;
    }

    public int getNumTrees() {
        return ntrees;
    }

    public int getDimension() {
        return dim;
    }

    public int getSize() {
        return size;
    }

    int[] treeStarts() {
        return Arrays.copyOf(nbegin, nbegin.length);
    }

    @Override
    public String toString() {
        return "RegressionForest{trees=" + ntrees + ", dim=" + dim + ", size=" + size + '}';
    }
}
