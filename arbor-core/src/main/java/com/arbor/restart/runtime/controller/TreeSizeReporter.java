/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.controller;

import com.arbor.restart.api.ISearchEngine;
import com.arbor.restart.runtime.estimation.BacktrackEstimator;
import com.arbor.restart.runtime.estimation.TimeSeries;
import com.arbor.restart.runtime.estimation.TimeSeriesKind;
import com.arbor.restart.runtime.forest.RegressionForest;
import com.arbor.restart.runtime.tree.TreeData;

import java.util.Locale;
import java.util.Map;

/**
 * Combines the individual estimators into one tree-size estimate and renders the
 * human-readable report, statistics table and completion column.
 *
 * <p>The text formats are informational and may change.
 */
final class TreeSizeReporter {

    /** Number of features the completion forest expects. */
    static final int COMPLETION_FEATURES = 9;

    private static final double EARLY_PHASE = 0.3;
    private static final double MIDDLE_PHASE = 0.6;

    // columns follow TimeSeriesKind order: gap, progress, leaf-frequency, ssg, open-nodes
    private static final double[] EARLY_WEIGHTS = {0.002, 0.381, 0.469, 0.292, 0.004};
    private static final double[] MIDDLE_WEIGHTS = {0.011, 0.193, 0.351, 0.012, 0.051};
    private static final double[] LATE_WEIGHTS = {0.000, 0.033, 0.282, 0.003, 0.024};
    private static final double MIDDLE_BACKTRACK_WEIGHT = 0.156;
    private static final double LATE_BACKTRACK_WEIGHT = 0.579;

    private final ISearchEngine engine;
    private final TreeData treeData;
    private final Map<TimeSeriesKind, TimeSeries> timeSeries;
    private final BacktrackEstimator backtrack;

    TreeSizeReporter(ISearchEngine engine, TreeData treeData,
                     Map<TimeSeriesKind, TimeSeries> timeSeries, BacktrackEstimator backtrack) {
        this.engine = engine;
        this.treeData = treeData;
        this.timeSeries = timeSeries;
        this.backtrack = backtrack;
    }

    /**
     * Piecewise linear combination of the time-series and backtrack estimates, weighted by
     * search phase. Never below the number of nodes created so far.
     */
    double combinedEstimate() {
        double progress = treeData.getProgress();
        double nnodes = treeData.getNnodes();

        double[] weights;
        double backtrackWeight;
        if (progress <= EARLY_PHASE) {
            weights = EARLY_WEIGHTS;
            backtrackWeight = 0.0;
        } else if (progress <= MIDDLE_PHASE) {
            weights = MIDDLE_WEIGHTS;
            backtrackWeight = MIDDLE_BACKTRACK_WEIGHT;
        } else {
            weights = LATE_WEIGHTS;
            backtrackWeight = LATE_BACKTRACK_WEIGHT;
        }

        double estimate = 0.0;
        for (TimeSeriesKind kind : TimeSeriesKind.values()) {
            estimate += weights[kind.ordinal()] * orNodes(timeSeries.get(kind).estimate(treeData), nnodes);
        }
        if (backtrackWeight > 0.0) {
            estimate += backtrackWeight * orNodes(backtrack.estimate(), nnodes);
        }
        return Math.max(estimate, nnodes);
    }

    private static double orNodes(double estimate, double nnodes) {
        return estimate < 0.0 ? nnodes : estimate;
    }

    /**
     * Fraction of the search that is complete, in (-inf, 1].
     */
    double completedFraction(RegressionForest forest) {
        double completed;
        if (forest != null && forest.getDimension() == COMPLETION_FEATURES) {
            completed = forest.predict(completionFeatures());
        } else {
            completed = 0.5828 + 0.3667 * treeData.getProgress()
                    - 0.6101 * timeSeries.get(TimeSeriesKind.SSG).getCurrentValue();
        }
        return Math.min(completed, 1.0);
    }

    double[] completionFeatures() {
        TimeSeries progress = timeSeries.get(TimeSeriesKind.PROGRESS);
        TimeSeries ssg = timeSeries.get(TimeSeriesKind.SSG);
        TimeSeries leafFrequency = timeSeries.get(TimeSeriesKind.LEAF_FREQUENCY);
        TimeSeries gap = timeSeries.get(TimeSeriesKind.GAP);
        double openNodesTrend = timeSeries.get(TimeSeriesKind.OPEN_NODES).getTrend();

        return new double[]{
                progress.getCurrentValue(), zeroIfUndefined(progress.getTrend()),
                ssg.getCurrentValue(), zeroIfUndefined(ssg.getTrend()),
                leafFrequency.getCurrentValue(), zeroIfUndefined(leafFrequency.getTrend()),
                gap.getCurrentValue(), zeroIfUndefined(gap.getTrend()),
                openNodesTrend < 0 ? 1.0 : 0.0
        };
    }

    private static double zeroIfUndefined(double value) {
        return Double.isNaN(value) ? 0.0 : value;
    }

    /**
     * Eight-character display column with the completed percentage.
     */
    String completionColumn(RegressionForest forest) {
        double completed = completedFraction(forest);
        if (treeData.getProgress() >= 0.005 && completed > 0) {
            return String.format(Locale.ROOT, "%7.2f%%", 100 * completed);
        }
        return " unknown";
    }

    /**
     * @param reportNumber positive report number, or {@code 0} for an unnumbered table
     */
    String report(int reportNumber) {
        StringBuilder sb = new StringBuilder();
        if (reportNumber > 0) {
            sb.append(String.format(Locale.ROOT, "Report %d%nTime Elapsed: %.2f%n", reportNumber, engine.solvingTime()));
        }
        sb.append(String.format(Locale.ROOT, "  %-17s: %d nodes (%d visited, %d inner, %d leaves, %d open), progress: %.4f, ssg: %.4f%n",
                "Tree Data",
                treeData.getNnodes(), treeData.getNvisited(), treeData.getNinner(),
                treeData.getNleaves(), treeData.getNopen(), treeData.getProgress(),
                treeData.getSsg().getValue()));

        sb.append(String.format(Locale.ROOT, "Tree Estimation    : %11s %11s %11s %11s %11s%n",
                "estim", "value", "trend", "resolution", "smooth"));
        sb.append(String.format(Locale.ROOT, "  %-17s: %11.0f %11s %11s %11s %11s%n",
                "wbe", backtrack.estimate(), "-", "-", "-", "-"));
        sb.append(String.format(Locale.ROOT, "  %-17s: %11.0f %11s %11s %11s %11s%n",
                "tree profile", engine.treeProfileEstimate(), "-", "-", "-", "-"));

        for (TimeSeries series : timeSeries.values()) {
            sb.append(String.format(Locale.ROOT, "  %-17s: %11.0f %11.5f %11s %11d %11s%n",
                    series.getName(),
                    series.estimate(treeData),
                    series.getCurrentValue(),
                    format(series.getTrend(), 5),
                    series.getResolution(),
                    format(series.getSmoothEstimation(), 0)));
        }
        sb.append(String.format(Locale.ROOT, "  %-17s: %11.0f%n", "combined", combinedEstimate()));

        if (reportNumber > 0) {
            sb.append("End of Report ").append(reportNumber).append(System.lineSeparator());
        }
        return sb.toString();
    }

    String statisticsTable(int restartsPerformed, int reportsEmitted) {
        return String.format(Locale.ROOT, "Restart Controller : %d restarts, %d reports%n", restartsPerformed, reportsEmitted)
                + report(0);
    }

    private static String format(double value, int digits) {
        if (Double.isNaN(value)) {
            return "-";
        }
        return String.format(Locale.ROOT, "%11." + digits + "f", value);
    }
}
