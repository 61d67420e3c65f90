package io.recordstore.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.recordstore.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code recordstore.writes}: committed writes seen by the purge scheduler</li>
 *   <li>{@code recordstore.sweep.started}: sweeps started</li>
 *   <li>{@code recordstore.sweep.debounced}: threshold crossings ignored during a sweep or cooldown</li>
 *   <li>{@code recordstore.sweep.timeouts}: sweeps abandoned after the sweep timeout</li>
 *   <li>{@code recordstore.purge.rows} (tag {@code type}): expired rows deleted</li>
 *   <li>{@code recordstore.purge.failures} (tag {@code type}): per-type purge failures</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code recordstore.sweep.active}: 1 while a sweep or its cooldown is in progress</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code recordstore.sweep.duration.ms}: wall time of completed sweeps</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Counter writes;
    private final Counter sweepsStarted;
    private final Counter sweepsDebounced;
    private final Counter sweepTimeouts;
    private final Gauge sweepingGauge;
    private final DistributionSummary sweepDuration;
    private final Map<String, Counter> purgedByType = new ConcurrentHashMap<>();
    private final Map<String, Counter> failuresByType = new ConcurrentHashMap<>();

    private final AtomicInteger sweeping = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "recordstore"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "recordstore");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "idp.recordstore"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.namePrefix = namePrefix;
        this.writes = Counter.builder(namePrefix + ".writes")
                .description("Committed writes seen by the purge scheduler")
                .register(registry);
        this.sweepsStarted = Counter.builder(namePrefix + ".sweep.started")
                .description("Sweeps started")
                .register(registry);
        this.sweepsDebounced = Counter.builder(namePrefix + ".sweep.debounced")
                .description("Threshold crossings ignored during a sweep or cooldown")
                .register(registry);
        this.sweepTimeouts = Counter.builder(namePrefix + ".sweep.timeouts")
                .description("Sweeps abandoned after exceeding the sweep timeout")
                .register(registry);

        this.sweepingGauge = Gauge.builder(namePrefix + ".sweep.active", sweeping, AtomicInteger::get)
                .register(registry);

        this.sweepDuration = DistributionSummary.builder(namePrefix + ".sweep.duration.ms")
                .description("Sweep wall time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementWrites() {
        if (closed) return;
        writes.increment();
    }

    @Override
    public void incrementSweepsStarted() {
        if (closed) return;
        sweepsStarted.increment();
    }

    @Override
    public void incrementSweepsDebounced() {
        if (closed) return;
        sweepsDebounced.increment();
    }

    @Override
    public void incrementSweepTimeouts() {
        if (closed) return;
        sweepTimeouts.increment();
    }

    @Override
    public void recordPurged(String typeName, int rows) {
        if (closed) return;
        purgedByType.computeIfAbsent(typeName, t -> Counter.builder(namePrefix + ".purge.rows")
                        .description("Expired rows deleted")
                        .tag("type", t)
                        .register(registry))
                .increment(rows);
    }

    @Override
    public void incrementPurgeFailures(String typeName) {
        if (closed) return;
        failuresByType.computeIfAbsent(typeName, t -> Counter.builder(namePrefix + ".purge.failures")
                        .description("Per-type purge failures")
                        .tag("type", t)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordSweepDurationMs(long durationMs) {
        if (closed) return;
        sweepDuration.record(durationMs);
    }

    @Override
    public void recordSweeping(boolean active) {
        if (closed) return;
        sweeping.set(active ? 1 : 0);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Called by {@link io.recordstore.RecordStorage#close()} to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(List.of(writes, sweepsStarted, sweepsDebounced,
                sweepTimeouts, sweepingGauge, sweepDuration));
        meters.addAll(purgedByType.values());
        meters.addAll(failuresByType.values());
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
