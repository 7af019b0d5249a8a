package com.arbor.restart.infra.metrics.api;

import com.arbor.restart.infra.metrics.MetricsRegistry;

/**
 * Pluggable metrics backend, looked up with {@link java.util.ServiceLoader}. List the
 * implementing class in {@code META-INF/services/com.arbor.restart.infra.metrics.api.MetricsRegistryProvider};
 * it needs a public no-arg constructor.
 */
public interface MetricsRegistryProvider {

    /**
     * Called once per process. The returned registry is shared by every controller.
     */
    MetricsRegistry create();

    /**
     * The provider with the largest value wins when several are registered.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
