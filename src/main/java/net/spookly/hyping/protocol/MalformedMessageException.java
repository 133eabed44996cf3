package net.spookly.hyping.protocol;

/**
 * Bytes that do not form a valid frame: truncated, wrong version, unknown tag or bad field.
 */
public final class MalformedMessageException extends QueryException {
    public MalformedMessageException(String message) {
        super(message);
    }
}
