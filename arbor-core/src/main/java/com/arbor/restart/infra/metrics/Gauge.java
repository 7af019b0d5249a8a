package com.arbor.restart.infra.metrics;

/**
 * Point-in-time value such as the current tree progress.
 * Thread-safe.
 */
public interface Gauge {
    void set(double value);
    double value();
}
