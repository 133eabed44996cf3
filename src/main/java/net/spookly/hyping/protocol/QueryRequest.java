package net.spookly.hyping.protocol;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Decoded status request. The frame carries no payload besides reserved padding.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class QueryRequest {
    private final int version;
    private final int paddingBytes;
}
