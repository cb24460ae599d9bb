/**
 * Bounded-concurrency task dispatcher.
 *
 * <h2>Core Design</h2>
 * <p>{@link io.forker.Forker} runs at most a fixed number of submitted
 * {@link java.lang.Runnable tasks} at once on a worker pool and queues the rest in FIFO
 * order. Each task may carry an opaque correlation value that is handed back to
 * {@linkplain io.forker.ItemCompleteListener item-complete listeners} together with the
 * task's failure, if any. When the dispatcher runs out of work it notifies
 * {@linkplain io.forker.AllCompleteListener all-complete listeners} and releases threads
 * blocked in {@link io.forker.Forker#join()}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>forker-core</b> — dispatcher, listener contracts, metrics SPI (zero external deps)</li>
 *   <li><b>forker-micrometer</b> — {@linkplain io.forker.micrometer Micrometer metrics bridge}</li>
 *   <li><b>forker-spring-boot-starter</b> — auto-configuration bound to {@code forker.*} properties</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var results = new ConcurrentHashMap<Object, Throwable>();
 *
 * Forker forker = Forker.builder()
 *     .maxAllowed(2)
 *     .build()
 *     .onItemComplete((state, error) -> {
 *         if (error != null) results.put(state, error);
 *     });
 *
 * forker.submit(() -> resize("a.png"), "a.png")
 *       .submit(() -> resize("b.png"), "b.png")
 *       .submit(() -> resize("c.png"), "c.png");   // queued until a slot frees up
 *
 * boolean done = forker.join(30_000);
 * }</pre>
 *
 * @see io.forker.Forker
 * @see io.forker.ItemCompleteListener
 * @see io.forker.AllCompleteListener
 * @see io.forker.spi.MetricsExporter
 */
package io.forker;
