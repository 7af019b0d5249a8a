package com.arbor.restart.infra.metrics.impl.inmemory;

import com.arbor.restart.infra.metrics.MetricsRegistry;
import com.arbor.restart.infra.metrics.api.MetricsRegistryProvider;

/**
 * Provider for {@link InMemoryMetricsRegistry}.
 *
 * <p>To enable, register it in
 * {@code META-INF/services/com.arbor.restart.infra.metrics.api.MetricsRegistryProvider}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
