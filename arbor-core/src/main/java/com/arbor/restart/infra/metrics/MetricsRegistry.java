package com.arbor.restart.infra.metrics;

import com.arbor.restart.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Source of the controller's counters, gauges and timers. Backends plug in through
 * {@link com.arbor.restart.infra.metrics.api.MetricsRegistryProvider}.
 *
 * <pre>{@code
 * Counter restarts = MetricsRegistry.getInstance().counter("restart_requests_total");
 * restarts.increment();
 * }</pre>
 *
 * <p>Names are snake_case. Tags are alternating key/value strings; backends that do not
 * support labels may ignore them. Asking twice for the same name returns the same metric.
 */
public interface MetricsRegistry {

    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * Registry chosen at class-load time, or a registry that records nothing when no
     * provider is on the classpath.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
