package com.arbor.restart.infra.metrics.impl.inmemory;

import com.arbor.restart.infra.metrics.Counter;
import com.arbor.restart.infra.metrics.Gauge;
import com.arbor.restart.infra.metrics.MetricsRegistry;
import com.arbor.restart.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps every metric in memory so tests can read them back:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * RestartController controller = new RestartController(engine, config, metrics);
 * // ... feed node events ...
 * assertThat(metrics.getCounterValue("restart_requests_total")).isEqualTo(1L);
 * }</pre>
 *
 * <p>Tags are ignored; a metric is identified by its name.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counterByName = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gaugeByName = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timerByName = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counterByName.computeIfAbsent(name, InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gaugeByName.computeIfAbsent(name, InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timerByName.computeIfAbsent(name, InMemoryTimer::new);
    }

    /** Zero for a counter that was never created. */
    public long getCounterValue(String name) {
        InMemoryCounter counter = counterByName.get(name);
        return counter == null ? 0L : counter.count();
    }

    /** Zero for a gauge that was never created. */
    public double getGaugeValue(String name) {
        InMemoryGauge gauge = gaugeByName.get(name);
        return gauge == null ? 0.0 : gauge.value();
    }

    public List<Duration> getTimerRecordings(String name) {
        InMemoryTimer timer = timerByName.get(name);
        return timer == null ? List.of() : timer.getRecordings();
    }

    public void reset() {
        counterByName.clear();
        gaugeByName.clear();
        timerByName.clear();
    }
}
