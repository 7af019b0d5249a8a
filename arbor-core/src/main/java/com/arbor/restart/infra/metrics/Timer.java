package com.arbor.restart.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Distribution of durations, e.g. the time spent processing one node event.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Runs {@code callable} and records how long it took, also when it throws.
     */
    <T> T record(Callable<T> callable) throws Exception;

    void record(Duration duration);

    /**
     * @param percentile in {@code [0, 1]}; {@code 0.5} is the median
     * @return {@link Duration#ZERO} when nothing was recorded
     */
    Duration percentile(double percentile);
}
