package io.forker.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory that creates named daemon threads with a sequential suffix.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, etc. All threads
 * are daemon threads so a dispatcher that is simply dropped never holds the JVM open.
 * Anything that escapes a worker (an {@link Error} from a task or a listener) is
 * logged at {@code SEVERE} before the thread dies.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    static final Thread.UncaughtExceptionHandler LOGGING_HANDLER = (thread, failure) ->
            logger.log(Level.SEVERE, "Uncaught failure on worker thread " + thread.getName(), failure);

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
        return thread;
    }
}
