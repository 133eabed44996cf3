package net.spookly.hyping.protocol;

import java.time.Duration;

/**
 * No response arrived before the caller's deadline.
 */
public final class QueryTimeoutException extends QueryException {
    private final Duration timeout;

    public QueryTimeoutException(Duration timeout) {
        super("No response within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
