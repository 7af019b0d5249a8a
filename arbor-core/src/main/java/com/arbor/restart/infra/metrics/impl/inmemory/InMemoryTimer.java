package com.arbor.restart.infra.metrics.impl.inmemory;

import com.arbor.restart.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Timer that keeps every recorded duration. Percentiles interpolate linearly between the
 * two nearest ranks.
 */
final class InMemoryTimer implements Timer {

    private final String name;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String name) {
        this.name = name;
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        long begin = System.nanoTime();
        try {
            return callable.call();
        } finally {
            recordings.add(Duration.ofNanos(System.nanoTime() - begin));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Timer " + name + " got a negative duration: " + duration);
        }
        recordings.add(duration);
    }

    @Override
    public Duration percentile(double percentile) {
        long[] nanos = recordings.stream().mapToLong(Duration::toNanos).sorted().toArray();
        if (nanos.length == 0) {
            return Duration.ZERO;
        }
        double rank = (nanos.length - 1) * Math.max(0.0, Math.min(1.0, percentile));
        int below = (int) rank;
        if (below == nanos.length - 1) {
            return Duration.ofNanos(nanos[below]);
        }
        double fraction = rank - below;
        return Duration.ofNanos(nanos[below] + (long) ((nanos[below + 1] - nanos[below]) * fraction));
    }

    List<Duration> getRecordings() {
        return List.copyOf(recordings);
    }

    @Override
    public String toString() {
        return "InMemoryTimer{" + name + ", n=" + recordings.size() + ", median=" + percentile(0.5) + "}";
    }
}
