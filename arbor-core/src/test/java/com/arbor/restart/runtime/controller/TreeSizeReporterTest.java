package com.arbor.restart.runtime.controller;

import com.arbor.restart.runtime.estimation.BacktrackEstimator;
import com.arbor.restart.runtime.estimation.TimeSeries;
import com.arbor.restart.runtime.estimation.TimeSeriesKind;
import com.arbor.restart.runtime.tree.TreeData;
import com.arbor.restart.testing.FakeNode;
import com.arbor.restart.testing.FakeSearchEngine;
import com.arbor.restart.util.Tolerances;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TreeSizeReporterTest {

    private FakeSearchEngine engine;
    private TreeData treeData;
    private Map<TimeSeriesKind, TimeSeries> timeSeries;
    private BacktrackEstimator backtrack;
    private TreeSizeReporter reporter;

    @BeforeEach
    void setUp() {
        engine = new FakeSearchEngine();
        Tolerances tolerances = Tolerances.of(engine);
        treeData = new TreeData(engine, tolerances);
        timeSeries = new EnumMap<>(TimeSeriesKind.class);
        for (TimeSeriesKind kind : TimeSeriesKind.values()) {
            timeSeries.put(kind, new TimeSeries(kind, tolerances));
        }
        backtrack = new BacktrackEstimator();
        reporter = new TreeSizeReporter(engine, treeData, timeSeries, backtrack);
    }

    @Test
    @DisplayName("Should substitute the node count for missing estimates early in the search")
    void shouldSubstituteNodeCountEarly() {
        FakeNode root = engine.createRoot(0.0);
        engine.branch(root, 2, 1.0);
        observe(root, 2);

        // all series undefined, early weights sum to 1.148
        assertThat(reporter.combinedEstimate()).isCloseTo(1.148 * 3, within(1e-9));
    }

    @Test
    @DisplayName("Should never estimate fewer nodes than created")
    void shouldNotDropBelowNodeCount() {
        FakeNode root = engine.createRoot(0.0);
        List<FakeNode> children = engine.branch(root, 2, 1.0);
        observe(root, 2);
        List<FakeNode> grandchildren = engine.branch(children.get(0), 2, 2.0);
        observe(children.get(0), 2);
        for (FakeNode leaf : grandchildren) {
            engine.prune(leaf);
            observe(leaf, 0);
        }
        engine.prune(children.get(1));
        observe(children.get(1), 0);

        assertThat(treeData.getProgress()).isEqualTo(1.0);
        assertThat(reporter.combinedEstimate()).isGreaterThanOrEqualTo(treeData.getNnodes());
    }

    @Test
    void completedFraction_linearFallback() {
        FakeNode root = engine.createRoot(0.0);
        List<FakeNode> children = engine.branch(root, 2, 1.0);
        observe(root, 2);
        engine.prune(children.get(0));
        observe(children.get(0), 0);

        // progress 0.5, no incumbent so ssg 1
        assertThat(reporter.completedFraction(null))
                .isCloseTo(0.5828 + 0.3667 * 0.5 - 0.6101, within(1e-12));
        assertThat(reporter.completionColumn(null)).isEqualTo("  15.61%");
    }

    @Test
    void completionColumn_unknownBeforeProgress() {
        assertThat(reporter.completionColumn(null)).isEqualTo(" unknown");
    }

    @Test
    void completionFeatures_replaceUndefinedTrends() {
        double[] features = reporter.completionFeatures();

        assertThat(features).hasSize(TreeSizeReporter.COMPLETION_FEATURES);
        assertThat(features).doesNotContain(Double.NaN);
        assertThat(features[2]).isEqualTo(1.0);
    }

    @Test
    void report_listsEstimators() {
        FakeNode root = engine.createRoot(0.0);
        List<FakeNode> children = engine.branch(root, 2, 1.0);
        observe(root, 2);
        engine.prune(children.get(0));
        observe(children.get(0), 0);

        String report = reporter.report(3);

        assertThat(report).startsWith("Report 3").contains("End of Report 3");
        assertThat(report).contains("Tree Data").contains("wbe").contains("tree profile").contains("combined");
        for (TimeSeriesKind kind : TimeSeriesKind.values()) {
            assertThat(report).contains(kind.displayName());
        }
    }

    @Test
    void statisticsTable_unnumbered() {
        String table = reporter.statisticsTable(2, 5);

        assertThat(table).startsWith("Restart Controller : 2 restarts, 5 reports");
        assertThat(table).doesNotContain("End of Report");
    }

    private void observe(FakeNode node, int nchildren) {
        treeData.update(node, nchildren);
        for (TimeSeries series : timeSeries.values()) {
            series.update(engine, treeData, nchildren == 0);
        }
        if (nchildren == 0) {
            backtrack.update(node);
        }
    }
}
