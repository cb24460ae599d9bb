package io.forker;

/**
 * Callback invoked once for every task submitted to a {@link Forker}, after the task
 * body has returned or thrown.
 *
 * <p>Listeners run synchronously on the thread that executed the task. A
 * {@link RuntimeException} thrown here is logged and does not affect other listeners or
 * the dispatcher's bookkeeping.
 *
 * @see Forker#onItemComplete(ItemCompleteListener)
 */
@FunctionalInterface
public interface ItemCompleteListener {

    /**
     * Called when a task finishes.
     *
     * @param state the correlation value passed to {@link Forker#submit(Runnable, Object)},
     *              or {@code null}
     * @param error null on success, the failure the task threw otherwise
     */
    void onItemComplete(Object state, Throwable error);
}
