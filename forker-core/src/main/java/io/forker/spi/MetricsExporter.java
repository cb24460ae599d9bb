package io.forker.spi;

/**
 * Observability hook for exporting dispatcher counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of tasks handed to the worker pool, whether directly on
     * submission or after waiting in the pending queue.
     */
    void incrementTaskStarted();

    /**
     * Increments the count of submissions that found the dispatcher at capacity and
     * were placed in the pending queue.
     */
    void incrementTaskQueued();

    /**
     * Increments the count of tasks that returned normally.
     */
    void incrementTaskSucceeded();

    /**
     * Increments the count of tasks that threw, or that the worker pool rejected.
     */
    void incrementTaskFailed();

    /**
     * Increments the count of completion listeners that threw.
     */
    default void incrementListenerFailure() {
    }

    /**
     * Increments the count of finished work episodes, i.e. all-complete notifications.
     */
    default void incrementEpisodeComplete() {
    }

    /**
     * Records the number of tasks currently holding a slot.
     *
     * @param running running count (always non-negative)
     */
    void recordRunning(int running);

    /**
     * Records the number of tasks waiting for a slot.
     *
     * @param depth pending queue length (always non-negative)
     */
    void recordQueueDepth(int depth);

    /**
     * Records the time spent executing a task body.
     *
     * @param durationMs task execution time in milliseconds (always non-negative)
     */
    default void recordTaskDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementTaskStarted() {
        }

        @Override
        public void incrementTaskQueued() {
        }

        @Override
        public void incrementTaskSucceeded() {
        }

        @Override
        public void incrementTaskFailed() {
        }

        @Override
        public void recordRunning(int running) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
