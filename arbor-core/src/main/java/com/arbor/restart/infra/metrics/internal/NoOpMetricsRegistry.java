package com.arbor.restart.infra.metrics.internal;

import com.arbor.restart.infra.metrics.Counter;
import com.arbor.restart.infra.metrics.Gauge;
import com.arbor.restart.infra.metrics.MetricsRegistry;
import com.arbor.restart.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Registry used when no {@code MetricsRegistryProvider} is on the classpath.
 * Every metric discards its input; timed callables still run.
 */
public enum NoOpMetricsRegistry implements MetricsRegistry {
    INSTANCE;

    @Override
    public Counter counter(String name, String... tags) {
        return Discarding.METRIC;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return Discarding.METRIC;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return Discarding.METRIC;
    }

    private enum Discarding implements Counter, Gauge, Timer {
        METRIC;

        @Override
        public void increment() {
        }

        @Override
        public void increment(long amount) {
        }

        @Override
        public long count() {
            return 0L;
        }

        @Override
        public void set(double value) {
        }

        @Override
        public double value() {
            return 0.0;
        }

        @Override
        public <T> T record(Callable<T> callable) throws Exception {
            return callable.call();
        }

        @Override
        public void record(Duration duration) {
        }

        @Override
        public Duration percentile(double percentile) {
            return Duration.ZERO;
        }
    }
}
