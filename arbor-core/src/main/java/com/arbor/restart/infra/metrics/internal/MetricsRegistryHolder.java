package com.arbor.restart.infra.metrics.internal;

import com.arbor.restart.infra.metrics.MetricsRegistry;
import com.arbor.restart.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Resolves the process-wide registry on first use of {@link MetricsRegistry#getInstance()}.
 * Not part of the public API.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry INSTANCE = resolve();

    private MetricsRegistryHolder() {
    }

    private static MetricsRegistry resolve() {
        Optional<MetricsRegistryProvider> best = ServiceLoader.load(MetricsRegistryProvider.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority));

        if (best.isEmpty()) {
            logger.fine("No MetricsRegistryProvider registered, metrics are discarded");
            return NoOpMetricsRegistry.INSTANCE;
        }
        MetricsRegistryProvider provider = best.get();
        logger.info("Restart metrics backed by " + provider.name() + " (priority " + provider.priority() + ")");
        return provider.create();
    }
}
