package com.arbor.restart.infra.metrics.impl.inmemory;

import com.arbor.restart.infra.metrics.Gauge;

/**
 * Gauge holding the last value written.
 */
final class InMemoryGauge implements Gauge {

    private final String name;
    private volatile double value;

    InMemoryGauge(String name) {
        this.name = name;
    }

    @Override
    public void set(double newValue) {
        value = newValue;
    }

    @Override
    public double value() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{name='%s', value=%.4f}", name, value);
    }
}
