package net.spookly.hyping.status;

/**
 * Read side of the live status value shared with the query responder.
 */
public interface StatusSource {
    /**
     * Latest committed record. Never blocks on a concurrent publish.
     */
    StatusRecord current();

    /**
     * Version of {@link #current()}, starting at 0 for the initial record.
     */
    long version();

    /**
     * Register a listener for records published after this call.
     */
    StatusSubscription subscribe(StatusListener listener);
}
