package net.spookly.hyping.status;

/**
 * Callback for newly published status records.
 */
@FunctionalInterface
public interface StatusListener {
    /**
     * Invoked on the publishing thread after {@code record} became current.
     */
    void onStatus(StatusRecord record, long version);
}
