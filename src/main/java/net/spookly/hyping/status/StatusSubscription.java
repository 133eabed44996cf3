package net.spookly.hyping.status;

/**
 * Handle returned by {@link StatusSource#subscribe(StatusListener)}.
 */
public interface StatusSubscription extends AutoCloseable {
    /**
     * Stop delivering updates to the listener. Idempotent.
     */
    @Override
    void close();
}
