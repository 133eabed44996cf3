package net.spookly.hyping.protocol;

/**
 * Base type for every failure a status query can surface.
 */
public abstract class QueryException extends Exception {
    protected QueryException(String message) {
        super(message);
    }

    protected QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
