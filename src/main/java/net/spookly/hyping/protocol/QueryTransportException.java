package net.spookly.hyping.protocol;

/**
 * The transport is unusable (bind failure, socket closed, unrecoverable I/O error).
 */
public final class QueryTransportException extends QueryException {
    public QueryTransportException(String message) {
        super(message);
    }

    public QueryTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
