package io.forker;

import io.forker.spi.MetricsExporter;
import io.forker.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded-concurrency task dispatcher.
 *
 * <p>At most {@link #maxAllowed()} submitted tasks run at once on the worker pool; the
 * rest wait in a FIFO queue. When a task finishes, its slot is handed straight to the
 * next queued task, so the running count stays at the cap while a backlog exists.
 * Every task is reported once to the {@linkplain #onItemComplete item-complete}
 * listeners. When nothing is running or queued any more, the
 * {@linkplain #onAllComplete all-complete} listeners fire once and threads blocked in
 * {@link #join()} are released.
 *
 * <p>{@code join} only waits for the running count to reach zero. The count drops before
 * the all-complete listeners are called, so a join may return while they are still
 * running on the worker thread.
 *
 * <p>Admission (cap check, slot claim, enqueue) and the hand-off on completion happen
 * under one queue lock, so the cap holds exactly even with many submitting threads.
 * Listener lists have their own lock that is never held while listeners run, and the
 * join barrier uses a third lock.
 *
 * <pre>{@code
 * Forker forker = new Forker(4)
 *     .onItemComplete((state, error) -> {
 *       if (error != null) logger.log(Level.WARNING, "Upload failed: " + state, error);
 *     })
 *     .onAllComplete(() -> logger.info("All uploads finished"));
 *
 * for (Path file : files) {
 *   forker.submit(() -> upload(file), file);
 * }
 * forker.join();
 * }</pre>
 *
 * <p>This class is thread-safe. There is no shutdown: a dispatcher is simply dropped
 * once idle. Tasks that have started cannot be cancelled.
 *
 * @see Forker.Builder
 */
public final class Forker {
  private static final Logger logger = Logger.getLogger(Forker.class.getName());

  private final int maxAllowed;
  private final Executor executor;
  private final MetricsExporter metrics;

  private final AtomicInteger running = new AtomicInteger();

  private final Object queueLock = new Object();
  private final Deque<PendingTask> pending = new ArrayDeque<>();

  private final Object listenerLock = new Object();
  private final List<ItemCompleteListener> itemListeners = new ArrayList<>();
  private final List<AllCompleteListener> allListeners = new ArrayList<>();

  private final ReentrantLock joinLock = new ReentrantLock();
  private final Condition idle = joinLock.newCondition();

  private final ThreadLocal<Deque<PendingTask>> draining = new ThreadLocal<>();

  /**
   * Creates a dispatcher on the shared worker pool with no metrics.
   *
   * @param maxAllowed maximum number of tasks running at once; zero or negative means unbounded
   */
  public Forker(int maxAllowed) {
    this(builder().maxAllowed(maxAllowed));
  }

  private Forker(Builder builder) {
    this.maxAllowed = builder.maxAllowed <= 0 ? Integer.MAX_VALUE : builder.maxAllowed;
    this.executor = builder.executor != null ? builder.executor : SharedWorkerPool.INSTANCE;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the concurrency cap; {@link Integer#MAX_VALUE} when unbounded.
   */
  public int maxAllowed() {
    return maxAllowed;
  }

  /**
   * Submits a task with no correlation value.
   *
   * @see #submit(Runnable, Object)
   */
  public Forker submit(Runnable task) {
    return submit(task, null);
  }

  /**
   * Submits a task. It starts immediately if a slot is free and otherwise waits in the
   * pending queue. This method never blocks on task execution.
   *
   * @param task  the work to run
   * @param state opaque value handed back to item-complete listeners for this task; may be null
   * @return this dispatcher
   * @throws NullPointerException if {@code task} is null
   */
  public Forker submit(Runnable task, Object state) {
    Objects.requireNonNull(task, "task");
    PendingTask item = new PendingTask(task, state);

    boolean queued;
    int depth;
    synchronized (queueLock) {
      queued = running.get() >= maxAllowed;
      if (queued) {
        pending.addLast(item);
      } else {
        running.incrementAndGet();
      }
      depth = pending.size();
    }

    if (queued) {
      metrics.incrementTaskQueued();
      metrics.recordQueueDepth(depth);
      logger.log(Level.FINE, "Task queued, {0} pending", depth);
    } else {
      start(item);
    }
    return this;
  }

  /**
   * Registers a listener called once per finished task.
   *
   * @return this dispatcher
   * @throws NullPointerException if {@code listener} is null
   */
  public Forker onItemComplete(ItemCompleteListener listener) {
    Objects.requireNonNull(listener, "listener");
    synchronized (listenerLock) {
      itemListeners.add(listener);
    }
    return this;
  }

  /**
   * Registers a listener called each time the dispatcher runs out of work.
   *
   * @return this dispatcher
   * @throws NullPointerException if {@code listener} is null
   */
  public Forker onAllComplete(AllCompleteListener listener) {
    Objects.requireNonNull(listener, "listener");
    synchronized (listenerLock) {
      allListeners.add(listener);
    }
    return this;
  }

  /**
   * Removes one registration of an item-complete listener.
   *
   * @return {@code true} if the listener was registered
   */
  public boolean removeItemCompleteListener(ItemCompleteListener listener) {
    synchronized (listenerLock) {
      return itemListeners.remove(listener);
    }
  }

  /**
   * Removes one registration of an all-complete listener.
   *
   * @return {@code true} if the listener was registered
   */
  public boolean removeAllCompleteListener(AllCompleteListener listener) {
    synchronized (listenerLock) {
      return allListeners.remove(listener);
    }
  }

  /**
   * Returns the number of tasks currently holding a slot.
   */
  public int countRunning() {
    return running.get();
  }

  /**
   * Returns the number of tasks waiting for a slot.
   */
  public int countPending() {
    synchronized (queueLock) {
      return pending.size();
    }
  }

  /**
   * Blocks until no task is running.
   *
   * <p>Returns as soon as the running count is zero, which can be before the
   * all-complete listeners of that episode have finished.
   *
   * <p>Must not be called from a listener or task of this dispatcher: the calling
   * thread would wait on itself.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void join() throws InterruptedException {
    joinLock.lock();
    try {
      while (running.get() != 0) {
        idle.await();
      }
    } finally {
      joinLock.unlock();
    }
  }

  /**
   * Blocks until no task is running or the timeout elapses.
   *
   * @param timeoutMs maximum wait in milliseconds; zero or negative checks without waiting
   * @return {@code true} if no task was running when this method returned
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean join(long timeoutMs) throws InterruptedException {
    long nanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
    joinLock.lock();
    try {
      while (running.get() != 0) {
        if (nanos <= 0L) {
          return false;
        }
        nanos = idle.awaitNanos(nanos);
      }
      return true;
    } finally {
      joinLock.unlock();
    }
  }

  /**
   * Blocks until no task is running or the timeout elapses. A timeout too large to
   * express in milliseconds waits indefinitely.
   *
   * @see #join(long)
   */
  public boolean join(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    long timeoutMs;
    try {
      timeoutMs = timeout.toMillis();
    } catch (ArithmeticException e) {
      // too large for a long: wait indefinitely, or not at all when negative
      timeoutMs = timeout.isNegative() ? 0L : Long.MAX_VALUE;
    }
    return join(timeoutMs);
  }

  /*
   * Caller has already claimed a slot for the task. The first call on a thread drains
   * iteratively: slots handed over while it runs (a direct executor finishing a task, or a
   * rejection) land on this thread's hand-off queue and are started by the loop below.
   */
  private void start(PendingTask item) {
    Deque<PendingTask> handOffs = draining.get();
    if (handOffs != null) {
      handOffs.addLast(item);
      return;
    }
    handOffs = new ArrayDeque<>();
    draining.set(handOffs);
    int rejections = 0;
    Throwable escaped = null;
    try {
      for (PendingTask next = item; next != null; next = handOffs.pollFirst()) {
        try {
          RejectedExecutionException rejected = execute(next);
          if (rejected != null) {
            logger.log(rejections++ == 0 ? Level.WARNING : Level.FINE,
                "Worker pool rejected task, reporting it as failed", rejected);
            complete(next, rejected);
          }
        } catch (RuntimeException | Error e) {
          // keep draining so claimed slots are not stranded, rethrow afterwards
          if (escaped == null) {
            escaped = e;
          } else if (escaped != e) {
            escaped.addSuppressed(e);
          }
        }
      }
    } finally {
      draining.remove();
    }
    if (rejections > 1) {
      logger.log(Level.WARNING, "Worker pool rejected {0} tasks in one hand-off run", rejections);
    }
    if (escaped instanceof Error) {
      throw (Error) escaped;
    }
    if (escaped instanceof RuntimeException) {
      throw (RuntimeException) escaped;
    }
  }

  private RejectedExecutionException execute(PendingTask item) {
    metrics.incrementTaskStarted();
    metrics.recordRunning(running.get());
    try {
      executor.execute(() -> run(item));
      return null;
    } catch (RejectedExecutionException e) {
      return e;
    }
  }

  private void run(PendingTask item) {
    long startNanos = System.nanoTime();
    Throwable failure = null;
    try {
      item.task().run();
    } catch (Throwable t) {
      failure = t;
    }
    metrics.recordTaskDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    complete(item, failure);
  }

  private void complete(PendingTask item, Throwable failure) {
    try {
      if (failure == null) {
        metrics.incrementTaskSucceeded();
      } else {
        metrics.incrementTaskFailed();
        logger.log(Level.FINE, "Task failed, state=" + item.state(), failure);
      }
      notifyItemComplete(item.state(), failure);
    } finally {
      release();
    }
  }

  private void release() {
    PendingTask next;
    int remaining;
    int depth;
    synchronized (queueLock) {
      next = pending.pollFirst();
      remaining = next != null ? running.get() : running.decrementAndGet();
      depth = pending.size();
    }
    metrics.recordQueueDepth(depth);

    if (next != null) {
      logger.log(Level.FINE, "Starting queued task, {0} still pending", depth);
      start(next);
      return;
    }

    metrics.recordRunning(remaining);
    if (remaining == 0) {
      try {
        metrics.incrementEpisodeComplete();
        notifyAllComplete();
      } finally {
        signalIdle();
      }
    }
  }

  private void notifyItemComplete(Object state, Throwable error) {
    List<ItemCompleteListener> snapshot;
    synchronized (listenerLock) {
      snapshot = List.copyOf(itemListeners);
    }
    for (ItemCompleteListener listener : snapshot) {
      try {
        listener.onItemComplete(state, error);
      } catch (RuntimeException ex) {
        metrics.incrementListenerFailure();
        logger.log(Level.WARNING, "Item-complete listener failed, state=" + state, ex);
      }
    }
  }

  private void notifyAllComplete() {
    List<AllCompleteListener> snapshot;
    synchronized (listenerLock) {
      snapshot = List.copyOf(allListeners);
    }
    for (AllCompleteListener listener : snapshot) {
      try {
        listener.onAllComplete();
      } catch (RuntimeException ex) {
        metrics.incrementListenerFailure();
        logger.log(Level.WARNING, "All-complete listener failed", ex);
      }
    }
  }

  private void signalIdle() {
    joinLock.lock();
    try {
      idle.signalAll();
    } finally {
      joinLock.unlock();
    }
  }

  private record PendingTask(Runnable task, Object state) {
  }

  /** Lazily created process-wide pool used when no executor is configured. */
  private static final class SharedWorkerPool {
    static final ExecutorService INSTANCE =
        Executors.newCachedThreadPool(new DaemonThreadFactory("forker-worker-"));
  }

  /** Builder for {@link Forker}. */
  public static final class Builder {
    private int maxAllowed = Runtime.getRuntime().availableProcessors();
    private Executor executor;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the maximum number of tasks running at once.
     *
     * <p>Optional. Defaults to the number of available processors. Zero or negative
     * means unbounded: every submission starts immediately.
     *
     * @param maxAllowed concurrency cap
     * @return this builder
     */
    public Builder maxAllowed(int maxAllowed) {
      this.maxAllowed = maxAllowed;
      return this;
    }

    /**
     * Sets the worker pool that runs task bodies.
     *
     * <p>Optional. Defaults to a shared cached pool of daemon threads named
     * {@code forker-worker-N}. The dispatcher never shuts the executor down; an
     * injected executor stays owned by the caller. A direct executor
     * ({@code Runnable::run}) runs each task on the submitting thread; a task submitted
     * from inside a running task then starts after that task returns.
     *
     * @param executor the worker pool
     * @return this builder
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets the metrics exporter for task counters, running count and queue depth.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the dispatcher. No threads are started until the first submission.
     *
     * @return a new {@link Forker}
     */
    public Forker build() {
      return new Forker(this);
    }
  }
}
