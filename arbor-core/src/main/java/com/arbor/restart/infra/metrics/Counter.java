package com.arbor.restart.infra.metrics;

/**
 * Monotonically increasing event count, e.g. processed nodes or requested restarts.
 * Thread-safe.
 */
public interface Counter {
    void increment();

    void increment(long amount);

    long count();
}
