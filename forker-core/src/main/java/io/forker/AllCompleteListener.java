package io.forker;

/**
 * Callback invoked when a {@link Forker} has no running and no pending tasks left,
 * once per work episode.
 *
 * @see Forker#onAllComplete(AllCompleteListener)
 */
@FunctionalInterface
public interface AllCompleteListener {

    void onAllComplete();
}
