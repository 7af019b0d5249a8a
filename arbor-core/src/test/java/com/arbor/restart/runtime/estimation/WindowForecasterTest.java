package com.arbor.restart.runtime.estimation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WindowForecasterTest {

    private WindowForecaster forecaster;

    @BeforeEach
    void setUp() {
        forecaster = new WindowForecaster();
    }

    @Test
    @DisplayName("Should return the first crossing of a decelerating quadratic")
    void shouldForecastDeceleratingQuadratic() {
        forecaster.addSample(0.0, 0);
        forecaster.addSample(0.25, 10);
        forecaster.addSample(0.6, 25);

        double quadratic = forecaster.forecastWindow(1.0, 3, true);
        double linear = forecaster.forecastWindow(1.0, 3, false);

        assertThat(linear).isCloseTo(0.4 / (0.6 / 25), within(1e-9));
        // progress slows down, so the target is reached later than the secant predicts
        assertThat(quadratic).isCloseTo(18.98653, within(1e-4));
        assertThat(quadratic).isGreaterThan(linear);
    }

    @Test
    @DisplayName("Should forecast less than linear when progress accelerates")
    void shouldForecastAcceleratingQuadratic() {
        forecaster.addSample(0.0, 0);
        forecaster.addSample(0.1, 10);
        forecaster.addSample(0.4, 20);

        double quadratic = forecaster.forecastWindow(1.0, 3, true);
        double linear = forecaster.forecastWindow(1.0, 3, false);

        assertThat(linear).isCloseTo(30.0, within(1e-9));
        assertThat(quadratic).isCloseTo(-20.0 + Math.sqrt(1000.0), within(1e-9));
        assertThat(quadratic).isLessThan(linear);
    }

    @Test
    void forecastWindow_clampsWindowToObservations() {
        forecaster.addSample(0.0, 0);
        forecaster.addSample(0.1, 10);
        forecaster.addSample(0.4, 20);

        assertThat(forecaster.forecastWindow(1.0, 100, false))
                .isEqualTo(forecaster.forecastWindow(1.0, 3, false));
        assertThat(forecaster.forecastWindow(1.0, 100, true))
                .isEqualTo(forecaster.forecastWindow(1.0, 3, true));
    }

    @Test
    void forecastWindow_usesOnlyTheLastSamples() {
        forecaster.addSample(0.0, 0);
        forecaster.addSample(0.1, 10);
        forecaster.addSample(0.4, 20);

        // velocity of the last two samples is 0.03 per node
        assertThat(forecaster.forecastWindow(1.0, 2, false)).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void forecastWindow_wrapsAroundRingBuffer() {
        for (int i = 0; i < 600; i++) {
            forecaster.addSample(i / 1000.0, i);
        }

        assertThat(forecaster.getNumObservations()).isEqualTo(600);
        assertThat(forecaster.getCurrentProgress()).isEqualTo(0.599);
        assertThat(forecaster.getCurrentResources()).isEqualTo(599.0);
        assertThat(forecaster.forecastWindow(1.0, 500, false)).isCloseTo(401.0, within(1e-6));
    }

    @Test
    void forecastWindow_noForecastWithOneSample() {
        forecaster.addSample(0.5, 10);

        assertThat(forecaster.forecastWindow(1.0, 10, true)).isNaN();
    }

    @Test
    void forecastWindow_stalledProgress() {
        forecaster.addSample(0.5, 10);
        forecaster.addSample(0.5, 20);

        assertThat(forecaster.forecastWindow(1.0, 10, false)).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    @DisplayName("Should not forecast when every window sample shares one node count")
    void shouldNotForecastWithoutResourceDelta() {
        forecaster.addSample(0.5, 10);
        forecaster.addSample(0.5, 10);

        assertThat(forecaster.forecastWindow(1.0, 2, false)).isNaN();
    }

    @Test
    void forecastWindow_undefinedAccelerationAtSameNodeCount() {
        forecaster.addSample(0.25, 17);
        forecaster.addSample(0.3125, 17);
        forecaster.addSample(0.375, 17);

        assertThat(forecaster.forecastWindow(1.0, 3, true)).isNaN();
        // progress without spending nodes is an infinite velocity, nothing remains
        assertThat(forecaster.forecastWindow(1.0, 3, false)).isZero();
    }

    @Test
    void forecastWindow_negativeWhenProgressDrops() {
        forecaster.addSample(0.5, 10);
        forecaster.addSample(0.4, 20);

        assertThat(forecaster.forecastWindow(1.0, 2, false)).isCloseTo(-60.0, within(1e-9));
    }

    @Test
    void forecast_zeroWhenTargetReached() {
        forecaster.addSample(0.5, 10);
        forecaster.addSample(1.0, 20);

        assertThat(forecaster.forecastWindow(1.0, 10, true)).isZero();
        assertThat(forecaster.forecastLinear(1.0)).isZero();
    }

    @Test
    @DisplayName("Should extrapolate the smoothed progress per leaf to a binary tree size")
    void shouldForecastLinear() {
        forecaster.addSample(0.25, 1);
        forecaster.addSample(0.5, 3);

        // smoothed trend 0.25 per leaf, so 4 leaves and 7 nodes in total
        assertThat(forecaster.getProgressSmoother().getTrend()).isCloseTo(0.25, within(1e-12));
        assertThat(forecaster.forecastLinear(1.0)).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void forecastLinear_noForecastWithoutSamples() {
        assertThat(forecaster.forecastLinear(1.0)).isNaN();
    }

    @Test
    void reset_forgetsSamples() {
        forecaster.addSample(0.5, 10);

        forecaster.reset();

        assertThat(forecaster.getNumObservations()).isZero();
        assertThat(forecaster.getCurrentProgress()).isZero();
        assertThat(forecaster.getResourceSmoother().getCount()).isZero();
    }
}
