package io.forker.spring.boot;

import io.forker.util.DaemonThreadFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker pool owned by the application context. Unlike the dispatcher's shared default
 * pool it is shut down when the context closes, waiting up to the configured timeout for
 * running tasks before interrupting them.
 */
public final class ForkerWorkerPool implements Executor, AutoCloseable {
    private static final Logger logger = Logger.getLogger(ForkerWorkerPool.class.getName());

    private final ExecutorService workers;
    private final long shutdownTimeoutMs;

    public ForkerWorkerPool(String threadNamePrefix, long shutdownTimeoutMs) {
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException("shutdownTimeoutMs must be >= 0");
        }
        this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory(threadNamePrefix));
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    @Override
    public void execute(Runnable command) {
        workers.execute(command);
    }

    public boolean isShutdown() {
        return workers.isShutdown();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Shutdown timeout exceeded; interrupting running tasks");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
