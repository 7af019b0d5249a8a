package com.arbor.restart.infra.metrics.impl.inmemory;

import com.arbor.restart.infra.metrics.Counter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counter backed by an {@link AtomicLong}.
 */
final class InMemoryCounter implements Counter {

    private final String name;
    private final AtomicLong count = new AtomicLong();

    InMemoryCounter(String name) {
        this.name = name;
    }

    @Override
    public void increment() {
        count.incrementAndGet();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter " + name + " cannot decrease by " + amount);
        }
        count.addAndGet(amount);
    }

    @Override
    public long count() {
        return count.get();
    }

    @Override
    public String toString() {
        return String.format("InMemoryCounter{name='%s', count=%d}", name, count());
    }
}
