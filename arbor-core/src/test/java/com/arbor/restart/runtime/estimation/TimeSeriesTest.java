package com.arbor.restart.runtime.estimation;

import com.arbor.restart.runtime.tree.TreeData;
import com.arbor.restart.testing.FakeNode;
import com.arbor.restart.testing.FakeSearchEngine;
import com.arbor.restart.util.Tolerances;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimeSeriesTest {

    private FakeSearchEngine engine;
    private TreeData treeData;
    private Tolerances tolerances;

    @BeforeEach
    void setUp() {
        engine = new FakeSearchEngine();
        tolerances = Tolerances.of(engine);
        treeData = new TreeData(engine, tolerances);
    }

    @Test
    @DisplayName("Should return -1 before the first leaf")
    void shouldHaveNoEstimateWithoutLeaves() {
        TimeSeries series = new TimeSeries(TimeSeriesKind.PROGRESS, tolerances);

        series.record(0.3, treeData, false);

        assertThat(series.estimate(treeData)).isEqualTo(-1.0);
        assertThat(series.getNumObservations()).isZero();
        assertThat(series.getCurrentValue()).isEqualTo(0.3);
        assertThat(series.getSmoothEstimation()).isNaN();
    }

    @Test
    @DisplayName("Should estimate 2 * nobs - 1 once the target is reached")
    void shouldEstimateFromObservationsWhenTargetReached() {
        TimeSeries series = new TimeSeries(TimeSeriesKind.LEAF_FREQUENCY, tolerances);

        series.record(0.5, treeData, true);
        series.record(0.5, treeData, true);
        series.record(0.5, treeData, true);

        assertThat(series.estimate(treeData)).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should extrapolate the trend to the target value")
    void shouldExtrapolateTrend() {
        FakeNode root = engine.createRoot(0.0);
        engine.branch(root, 2, 1.0);
        treeData.update(root, 2);

        TimeSeries series = new TimeSeries(TimeSeriesKind.SSG, tolerances);
        series.record(0.9, treeData, true);

        // trend -0.1 from the initial value 1, nine more samples to reach 0
        assertThat(series.getTrend()).isCloseTo(-0.1, within(1e-12));
        assertThat(series.estimate(treeData)).isCloseTo(19.0, within(1e-9));
        assertThat(series.getSmoothEstimation()).isCloseTo(19.0, within(1e-9));
    }

    @Test
    @DisplayName("Should fall back to twice the visited nodes when the trend points away")
    void shouldFallBackWhenTrendPointsAway() {
        FakeNode root = engine.createRoot(0.0);
        engine.branch(root, 2, 1.0);
        treeData.update(root, 2);

        TimeSeries series = new TimeSeries(TimeSeriesKind.SSG, tolerances);
        series.record(1.0, treeData, true);

        assertThat(series.getTrend()).isZero();
        assertThat(series.estimate(treeData)).isEqualTo(2.0);
    }

    @Test
    void smoothEstimation_weightsNewEstimates() {
        TimeSeries series = new TimeSeries(TimeSeriesKind.LEAF_FREQUENCY, tolerances);

        series.record(0.5, treeData, true);
        series.record(0.5, treeData, true);

        // estimates 1 and 3
        assertThat(series.getSmoothEstimation()).isCloseTo(0.25 * 1.0 + 0.75 * 3.0, within(1e-12));
    }

    @Test
    @DisplayName("Should halve the history and keep the smoothed estimate when the buffer is full")
    void shouldResampleWhenFull() {
        TimeSeries series = new TimeSeries(TimeSeriesKind.PROGRESS, TimeSeries.DEFAULT_CAPACITY, tolerances);

        for (int i = 0; i < 1023; i++) {
            series.record(0.5, treeData, true);
        }
        double smoothBefore = series.getSmoothEstimation();
        assertThat(series.getResolution()).isEqualTo(1);

        series.record(0.5, treeData, true);

        assertThat(series.getResolution()).isEqualTo(2);
        assertThat(series.getNumValues()).isEqualTo(512);
        assertThat(series.getNumObservations()).isEqualTo(1024);
        assertThat(series.getDes().getLevel()).isCloseTo(0.5, within(1e-12));
        assertThat(series.getSmoothEstimation()).isCloseTo(smoothBefore, within(1e-6));
    }

    @Test
    void resample_storesEverySecondValue() {
        TimeSeries series = new TimeSeries(TimeSeriesKind.PROGRESS, 8, tolerances);
        for (int i = 1; i <= 6; i++) {
            series.record(i / 10.0, treeData, true);
        }

        series.resample();

        assertThat(series.getNumValues()).isEqualTo(3);
        assertThat(series.getResolution()).isEqualTo(2);
        assertThat(series.getValues()).containsExactly(0.1, 0.3, 0.5);
        assertThat(series.getDes().getCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should observe the same current value with or without resampling")
    void shouldKeepCurrentValueAcrossResample() {
        TimeSeries resampled = new TimeSeries(TimeSeriesKind.PROGRESS, 16, tolerances);
        TimeSeries plain = new TimeSeries(TimeSeriesKind.PROGRESS, 16, tolerances);
        for (int i = 1; i <= 10; i++) {
            resampled.record(i / 20.0, treeData, true);
            plain.record(i / 20.0, treeData, true);
        }

        resampled.resample();
        resampled.record(0.6, treeData, true);
        plain.record(0.6, treeData, true);

        assertThat(resampled.getCurrentValue()).isEqualTo(plain.getCurrentValue());
    }

    @Test
    void constructor_rejectsOddCapacity() {
        assertThatThrownBy(() -> new TimeSeries(TimeSeriesKind.GAP, 7, tolerances))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("even");
    }

    @Test
    void observe_gap() {
        TimeSeries gap = new TimeSeries(TimeSeriesKind.GAP, tolerances);
        engine.createRoot(5.0);

        assertThat(gap.observe(engine, treeData)).isZero();

        engine.setPrimalBound(10.0);
        assertThat(gap.observe(engine, treeData)).isCloseTo(0.5, within(1e-12));

        engine.setPrimalBound(5.0);
        assertThat(gap.observe(engine, treeData)).isEqualTo(1.0);
    }

    @Test
    void observe_gapKeepsValueDuringRestart() {
        TimeSeries gap = new TimeSeries(TimeSeriesKind.GAP, tolerances);
        engine.createRoot(5.0);
        engine.setPrimalBound(10.0);
        gap.update(engine, treeData, true);

        engine.setPrimalBound(5.0);
        engine.setInRestart(true);

        assertThat(gap.observe(engine, treeData)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void observe_valuesBeforeFirstVisit() {
        assertThat(new TimeSeries(TimeSeriesKind.LEAF_FREQUENCY, tolerances).observe(engine, treeData)).isEqualTo(-0.5);
        assertThat(new TimeSeries(TimeSeriesKind.SSG, tolerances).observe(engine, treeData)).isEqualTo(1.0);
        assertThat(new TimeSeries(TimeSeriesKind.OPEN_NODES, tolerances).observe(engine, treeData)).isZero();
    }

    @Test
    void observe_valuesAfterVisits() {
        FakeNode root = engine.createRoot(0.0);
        FakeNode left = engine.branch(root, 2, 1.0).get(0);
        treeData.update(root, 2);
        engine.prune(left);
        treeData.update(left, 0);

        assertThat(new TimeSeries(TimeSeriesKind.LEAF_FREQUENCY, tolerances).observe(engine, treeData))
                .isCloseTo(0.25, within(1e-12));
        assertThat(new TimeSeries(TimeSeriesKind.OPEN_NODES, tolerances).observe(engine, treeData)).isEqualTo(1.0);
        assertThat(new TimeSeries(TimeSeriesKind.PROGRESS, tolerances).observe(engine, treeData)).isEqualTo(0.5);
    }
}
