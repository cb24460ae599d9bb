package io.forker.micrometer;

import io.forker.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a distribution summary with a {@link MeterRegistry}
 * for export to Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code forker.task.started} — tasks handed to the worker pool</li>
 *   <li>{@code forker.task.queued} — submissions that waited for a slot</li>
 *   <li>{@code forker.task.success} — tasks that returned normally</li>
 *   <li>{@code forker.task.failure} — tasks that threw or were rejected</li>
 *   <li>{@code forker.listener.failure} — completion listeners that threw</li>
 *   <li>{@code forker.episode.complete} — all-complete notifications</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code forker.running} — tasks currently holding a slot</li>
 *   <li>{@code forker.queue.depth} — tasks waiting for a slot</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code forker.task.duration.ms} — task body execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter taskStarted;
    private final Counter taskQueued;
    private final Counter taskSucceeded;
    private final Counter taskFailed;
    private final Counter listenerFailure;
    private final Counter episodeComplete;
    private final Gauge runningGauge;
    private final Gauge queueDepthGauge;
    private final DistributionSummary taskDuration;

    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger queueDepth = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "forker"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "forker");
    }

    /**
     * Creates an exporter with a custom metric name prefix, one per dispatcher when an
     * application runs several.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "thumbnails.forker"})
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
        this.taskStarted = Counter.builder(namePrefix + ".task.started")
                .description("Tasks handed to the worker pool")
                .register(registry);
        this.taskQueued = Counter.builder(namePrefix + ".task.queued")
                .description("Submissions that waited for a free slot")
                .register(registry);
        this.taskSucceeded = Counter.builder(namePrefix + ".task.success")
                .description("Tasks that returned normally")
                .register(registry);
        this.taskFailed = Counter.builder(namePrefix + ".task.failure")
                .description("Tasks that threw or were rejected by the worker pool")
                .register(registry);
        this.listenerFailure = Counter.builder(namePrefix + ".listener.failure")
                .description("Completion listeners that threw")
                .register(registry);
        this.episodeComplete = Counter.builder(namePrefix + ".episode.complete")
                .description("Times the dispatcher ran out of work")
                .register(registry);

        this.runningGauge = Gauge.builder(namePrefix + ".running", running, AtomicInteger::get)
                .register(registry);
        this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
                .register(registry);

        this.taskDuration = DistributionSummary.builder(namePrefix + ".task.duration.ms")
                .description("Task execution time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementTaskStarted() {
        if (closed) return;
        taskStarted.increment();
    }

    @Override
    public void incrementTaskQueued() {
        if (closed) return;
        taskQueued.increment();
    }

    @Override
    public void incrementTaskSucceeded() {
        if (closed) return;
        taskSucceeded.increment();
    }

    @Override
    public void incrementTaskFailed() {
        if (closed) return;
        taskFailed.increment();
    }

    @Override
    public void incrementListenerFailure() {
        if (closed) return;
        listenerFailure.increment();
    }

    @Override
    public void incrementEpisodeComplete() {
        if (closed) return;
        episodeComplete.increment();
    }

    @Override
    public void recordRunning(int running) {
        if (closed) return;
        this.running.set(running);
    }

    @Override
    public void recordQueueDepth(int depth) {
        if (closed) return;
        this.queueDepth.set(depth);
    }

    @Override
    public void recordTaskDurationMs(long durationMs) {
        if (closed) return;
        taskDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the dispatcher it observes is discarded, to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(taskStarted, taskQueued, taskSucceeded, taskFailed,
                listenerFailure, episodeComplete, runningGauge, queueDepthGauge, taskDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
