/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.estimation;

import com.arbor.restart.api.model.SearchNode;

/**
 * Weighted backtrack estimator of the total tree size.
 *
 * <p>Every leaf contributes its path probability {@code p} to the denominator and
 * {@code p} times the Knuth estimate of its root path to the numerator; the ratio is the
 * probability-weighted mean tree size over all leaves seen so far.
 */
public final class BacktrackEstimator {

    /**
     * How leaf probabilities are obtained.
     */
    public enum ProgressMethod {
        /** {@code 2^-depth}, i.e. a full binary tree. */
        UNIFORM,

        /** {@link SearchNode#fixedProbability()} as provided by the engine. */
        FIXED
    }

    private ProgressMethod progressMethod = ProgressMethod.UNIFORM;
    private double numerator;
    private double denominator;

    public void reset() {
        numerator = 0.0;
        denominator = 0.0;
    }

    public void update(SearchNode leaf) {
        double probability;
        double num;

        switch (progressMethod) {
            case FIXED: {
                probability = leaf.fixedProbability();
                double pathProbability = probability;
                SearchNode current = leaf;
                SearchNode parent;
                // the leaf itself counts once
                num = 1.0;
                while ((parent = current.parent()) != null) {
                    double arcProbability = current.fixedProbability() / parent.fixedProbability();
                    num += probability / pathProbability;
                    pathProbability /= arcProbability;
                    current = parent;
                }
                break;
            }
            case UNIFORM:
                probability = Math.pow(0.5, leaf.depth());
                num = 2 - probability;
                break;
            default:
                throw new IllegalStateException("Unsupported progress method: " + progressMethod);
        }

        numerator += num;
        denominator += probability;
    }

    /**
     * @return estimated total number of nodes, or {@code -1} before the first leaf
     */
    public double estimate() {
        if (denominator == 0.0) {
            return -1.0;
        }
        return numerator / denominator;
    }

    public ProgressMethod getProgressMethod() {
        return progressMethod;
    }

    public void setProgressMethod(ProgressMethod progressMethod) {
        this.progressMethod = progressMethod;
    }

    public double getNumerator() {
        return numerator;
    }

    public double getDenominator() {
        return denominator;
    }
}
