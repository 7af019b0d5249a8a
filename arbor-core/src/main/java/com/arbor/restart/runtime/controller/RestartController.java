/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.controller;

import com.arbor.restart.api.IRestartController;
import com.arbor.restart.api.ISearchEngine;
import com.arbor.restart.api.model.NodeEventKind;
import com.arbor.restart.api.model.ProgressMeasure;
import com.arbor.restart.api.model.RestartDecision;
import com.arbor.restart.api.model.SearchNode;
import com.arbor.restart.api.model.TreeStatistics;
import com.arbor.restart.infra.config.RestartConfig;
import com.arbor.restart.infra.metrics.Counter;
import com.arbor.restart.infra.metrics.Gauge;
import com.arbor.restart.infra.metrics.MetricsRegistry;
import com.arbor.restart.infra.metrics.Timer;
import com.arbor.restart.infra.telemetry.TracingService;
import com.arbor.restart.runtime.estimation.BacktrackEstimator;
import com.arbor.restart.runtime.estimation.TimeSeries;
import com.arbor.restart.runtime.estimation.TimeSeriesKind;
import com.arbor.restart.runtime.estimation.WindowForecaster;
import com.arbor.restart.runtime.forest.RegressionForest;
import com.arbor.restart.runtime.forest.RegressionForestFormatException;
import com.arbor.restart.runtime.forest.RegressionForestReader;
import com.arbor.restart.runtime.tree.TreeData;
import com.arbor.restart.util.Tolerances;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Observes the node events of a branch-and-bound search, maintains the tree statistics and
 * estimators, and asks the engine for a restart when the configured policy votes for one
 * often enough in a row.
 *
 * <h2>Event processing</h2>
 * <ol>
 *   <li>tree statistics and subtree-sum-gap are updated</li>
 *   <li>every time series observes the post-event state</li>
 *   <li>a report is emitted every percent of progress, if enabled</li>
 *   <li>pruned leaves feed the search-progress forecaster and the backtrack estimator</li>
 *   <li>the restart policy is evaluated</li>
 * </ol>
 *
 * <p>Not thread-safe. See {@link IRestartController}.
 */
public final class RestartController implements IRestartController {
    private static final Logger logger = Logger.getLogger(RestartController.class.getName());

    /** Number of reports over the whole search, one per percent of progress. */
    public static final int NREPORTS = 100;

    private static final double PROGRESS_TARGET = 1.0;

    private final ISearchEngine engine;
    private final RestartConfig config;
    private final Tracer tracer;

    private final TreeData treeData;
    private final Map<TimeSeriesKind, TimeSeries> timeSeries;
    private final BacktrackEstimator backtrack;
    private final WindowForecaster searchProgress;
    private final TreeSizeReporter reporter;

    // ===== METRICS =====
    private final Counter nodeEvents;
    private final Counter restartRequests;
    private final Counter hitCounterResets;
    private final Counter forestLoadFailures;
    private final Gauge progressGauge;
    private final Gauge ssgGauge;
    private final Gauge openNodesGauge;
    private final Gauge treeSizeGauge;
    private final Timer eventTimer;

    private Consumer<String> reportSink = logger::info;
    private RegressionForest forest;

    // ===== RUNTIME STATE =====
    private boolean active;
    private int nRestartsPerformed;
    private int restartHitCounter;
    private double progLastReport;
    private int nReports;

    public RestartController(ISearchEngine engine, RestartConfig config, MetricsRegistry metrics, Tracer tracer) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.config = Objects.requireNonNull(config, "config");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        Tolerances tolerances = Tolerances.of(engine);

        this.treeData = new TreeData(engine, tolerances);
        this.backtrack = new BacktrackEstimator();
        this.searchProgress = new WindowForecaster();

        EnumMap<TimeSeriesKind, TimeSeries> series = new EnumMap<>(TimeSeriesKind.class);
        for (TimeSeriesKind kind : TimeSeriesKind.values()) {
            series.put(kind, new TimeSeries(kind, tolerances));
        }
        this.timeSeries = Collections.unmodifiableMap(series);
        this.reporter = new TreeSizeReporter(engine, treeData, timeSeries, backtrack);

        this.nodeEvents = metrics.counter("restart_node_events_total");
        this.restartRequests = metrics.counter("restart_requests_total");
        this.hitCounterResets = metrics.counter("restart_hit_counter_resets_total");
        this.forestLoadFailures = metrics.counter("restart_forest_load_failures_total");
        this.progressGauge = metrics.gauge("restart_tree_progress");
        this.ssgGauge = metrics.gauge("restart_ssg_value");
        this.openNodesGauge = metrics.gauge("restart_open_nodes");
        this.treeSizeGauge = metrics.gauge("restart_tree_size_estimate");
        this.eventTimer = metrics.timer("restart_event_processing");
    }

    public RestartController(ISearchEngine engine, RestartConfig config, MetricsRegistry metrics) {
        this(engine, config, metrics, TracingService.getInstance().getTracer());
    }

    public RestartController(ISearchEngine engine, RestartConfig config) {
        this(engine, config, MetricsRegistry.getInstance());
    }

    // ===== LIFECYCLE =====

    @Override
    public void init() {
        if (!config.hasRegForest()) {
            return;
        }
        forest = loadForest(config.getRegForestFilename());
    }

    private RegressionForest loadForest(String filename) {
        Span span = tracer.spanBuilder("restart.forest.load").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("file", filename);
            RegressionForest loaded = new RegressionForestReader().read(Path.of(filename));
            span.setAttribute("trees", loaded.getNumTrees());
            logger.info("Loaded regression forest from " + filename + ": " + loaded);
            return loaded;
        } catch (IOException | InvalidPathException | RegressionForestFormatException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            forestLoadFailures.increment();
            logger.log(Level.WARNING, "Could not load regression forest from " + filename
                    + ", continuing without it: " + e.getMessage());
            return null;
        } finally {
            span.end();
        }
    }

    @Override
    public void onSolveBegin() {
        backtrack.setProgressMethod(config.getProgressMeasure() == ProgressMeasure.FIXED
                ? BacktrackEstimator.ProgressMethod.FIXED
                : BacktrackEstimator.ProgressMethod.UNIFORM);

        restartHitCounter = 0;
        progLastReport = 0.0;
        nReports = 0;

        treeData.reset();
        for (TimeSeries series : timeSeries.values()) {
            series.reset();
        }
        backtrack.reset();
        searchProgress.reset();

        active = true;
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Restart controller started with " + config + " after " + nRestartsPerformed + " restarts");
        }
    }

    @Override
    public RestartDecision onNodeEvent(SearchNode node, NodeEventKind kind, int nchildren) {
        if (nchildren < 0) {
            throw new IllegalArgumentException("Negative number of children " + nchildren + " for node " + node.number());
        }
        if (!active) {
            return RestartDecision.CONTINUE;
        }

        long start = System.nanoTime();
        try {
            nodeEvents.increment();
            return processEvent(node, kind, nchildren);
        } finally {
            eventTimer.record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private RestartDecision processEvent(SearchNode node, NodeEventKind kind, int nchildren) {
        boolean isLeaf = nchildren == 0;

        treeData.update(node, nchildren);
        for (TimeSeries series : timeSeries.values()) {
            series.update(engine, treeData, isLeaf);
        }

        progressGauge.set(treeData.getProgress());
        ssgGauge.set(treeData.getSsg().getValue());
        openNodesGauge.set(treeData.getNopen());

        maybeReport();

        if (kind.isLeafEvent()) {
            updateSearchProgress(node);
            backtrack.update(node);
        }

        if (engine.isInRestart()) {
            return RestartDecision.CONTINUE;
        }
        return evaluateRestart();
    }

    @Override
    public void onSolveEnd() {
        active = false;
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Restart controller stopped: " + treeData);
        }
    }

    @Override
    public void close() {
        active = false;
        forest = null;
    }

    // ===== REPORTING =====

    private void maybeReport() {
        if (!config.isPrintReports() || engine.isSolved()) {
            return;
        }
        double progress = treeData.getProgress();
        if (progress < progLastReport + 1.0 / NREPORTS) {
            return;
        }
        nReports++;
        progLastReport = Math.floor(progress * NREPORTS) / NREPORTS;

        treeSizeGauge.set(reporter.combinedEstimate());
        reportSink.accept(reporter.report(nReports));
    }

    /**
     * Sets the destination of periodic reports. Defaults to this class's logger.
     */
    public void setReportSink(Consumer<String> reportSink) {
        this.reportSink = Objects.requireNonNull(reportSink, "reportSink");
    }

    /**
     * Eight-character column with the percentage of the search that is complete, or
     * {@code " unknown"} early in the search.
     */
    public String completionColumn() {
        return reporter.completionColumn(forest);
    }

    /**
     * Human-readable table of the tree data and every estimator.
     */
    public String statisticsTable() {
        return reporter.statisticsTable(nRestartsPerformed, nReports);
    }

    @Override
    public double treeSizeEstimate() {
        return reporter.combinedEstimate();
    }

    @Override
    public TreeStatistics snapshot() {
        return new TreeStatistics(
                treeData.getNnodes(),
                treeData.getNopen(),
                treeData.getNinner(),
                treeData.getNleaves(),
                treeData.getNvisited(),
                treeData.getProgress(),
                treeData.getSsg().getValue(),
                reporter.combinedEstimate(),
                nRestartsPerformed,
                nReports);
    }

    // ===== RESTART POLICY =====

    private void updateSearchProgress(SearchNode leaf) {
        double current = searchProgress.getCurrentProgress();
        double progress;
        switch (config.getProgressMeasure()) {
            case GAP:
                progress = 1.0 - Math.min(engine.gap(), 1.0);
                break;
            case UNIFORM:
                progress = current + Math.pow(0.5, leaf.depth());
                break;
            case RATIO:
                progress = current + engine.nodeProbability(leaf);
                break;
            case FIXED:
                progress = current + leaf.fixedProbability();
                break;
            default:
                throw new IllegalStateException("Unsupported progress measure: " + config.getProgressMeasure());
        }
        searchProgress.addSample(progress, engine.nNodes());
    }

    private RestartDecision evaluateRestart() {
        if (!checkConditions()) {
            return RestartDecision.CONTINUE;
        }
        if (!shouldRestart()) {
            if (restartHitCounter > 0) {
                hitCounterResets.increment();
            }
            restartHitCounter = 0;
            return RestartDecision.CONTINUE;
        }

        restartHitCounter++;
        if (restartHitCounter < config.getHitCounterLimit()) {
            return RestartDecision.CONTINUE;
        }

        requestRestart();
        return RestartDecision.RESTART;
    }

    /**
     * Whether the restart limit and the minimum tree size still allow a restart.
     */
    boolean checkConditions() {
        int restartLimit = config.getRestartLimit();
        if (restartLimit >= 0 && nRestartsPerformed >= restartLimit) {
            return false;
        }

        long nodes = config.isCountOnlyLeaves()
                ? engine.nFeasibleLeaves() + engine.nInfeasibleLeaves() + engine.nObjLimLeaves()
                : engine.nNodes();
        return nodes >= config.getMinNodes();
    }

    /**
     * Vote of the configured policy, without the hit counter.
     */
    boolean shouldRestart() {
        switch (config.getRestartPolicy()) {
            case NEVER:
                return false;
            case ALWAYS:
                return true;
            case ESTIMATION:
                return estimationExceedsLimit();
            case PROGRESS:
                return forecastExceedsLimit();
            default:
                throw new IllegalStateException("Unsupported restart policy: " + config.getRestartPolicy());
        }
    }

    private boolean estimationExceedsLimit() {
        double estimate;
        switch (config.getEstimationMethod()) {
            case TREE_SIZE:
                estimate = engine.treeSizeEstimate();
                break;
            case TREE_PROFILE:
                estimate = engine.treeProfileEstimate();
                break;
            default:
                throw new IllegalStateException("Unsupported estimation method: " + config.getEstimationMethod());
        }
        if (estimate < 0.0) {
            return false;
        }
        return exceedsLimit(estimate, engine.nNodes());
    }

    private boolean forecastExceedsLimit() {
        double remaining = forecastRemaining();
        if (remaining < 0.0) {
            return false;
        }
        long nnodes = engine.nNodes();
        return exceedsLimit(nnodes + remaining, nnodes);
    }

    private boolean exceedsLimit(double estimate, long nnodes) {
        double factor = config.getEstimationFactor();
        if (!(estimate > nnodes * factor)) {
            return false;
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Estimation %g exceeds current number of nodes %d by a factor of %.1f",
                    estimate, nnodes, estimate / Math.max(nnodes, 1L)));
        }
        return true;
    }

    /**
     * Nodes still needed to finish the search according to the configured forecaster,
     * {@code -1} when there is no forecast (too few samples, undefined velocity) and
     * {@link Double#POSITIVE_INFINITY} if progress has stalled.
     */
    double forecastRemaining() {
        double remaining = forecast();
        return Double.isNaN(remaining) ? -1.0 : remaining;
    }

    private double forecast() {
        switch (config.getForecastMethod()) {
            case BACKTRACK: {
                double estimate = backtrack.estimate();
                if (estimate < 0.0) {
                    return -1.0;
                }
                return Math.max(0.0, estimate - engine.nNodes());
            }
            case LINEAR:
                return searchProgress.forecastLinear(PROGRESS_TARGET);
            case WINDOW:
                return searchProgress.forecastWindow(PROGRESS_TARGET, config.getWindowSize(), config.isUseAcceleration());
            default:
                throw new IllegalStateException("Unsupported forecast method: " + config.getForecastMethod());
        }
    }

    private void requestRestart() {
        Span span = tracer.spanBuilder("restart.request").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("nodes", engine.nNodes());
            span.setAttribute("policy", config.getRestartPolicy().name());

            nRestartsPerformed++;
            restartHitCounter = 0;
            restartRequests.increment();

            logger.info(String.format("Requesting restart %d after %d nodes (policy %s, progress %.4f)",
                    nRestartsPerformed, engine.nNodes(), config.getRestartPolicy(), treeData.getProgress()));
            engine.requestRestart();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    // ===== ACCESSORS =====

    public RestartConfig getConfig() {
        return config;
    }

    public TreeData getTreeData() {
        return treeData;
    }

    public TimeSeries getTimeSeries(TimeSeriesKind kind) {
        return timeSeries.get(kind);
    }

    public BacktrackEstimator getBacktrackEstimator() {
        return backtrack;
    }

    public WindowForecaster getSearchProgress() {
        return searchProgress;
    }

    public RegressionForest getForest() {
        return forest;
    }

    public boolean isActive() {
        return active;
    }

    public int getNRestartsPerformed() {
        return nRestartsPerformed;
    }

    public int getRestartHitCounter() {
        return restartHitCounter;
    }

    public int getNReports() {
        return nReports;
    }
}
