package net.spookly.hyping.client;

import java.time.Duration;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import net.spookly.hyping.status.StatusRecord;

/**
 * Decoded status plus the measured round trip.
 */
@Getter
@ToString
@Accessors(fluent = true)
@AllArgsConstructor
public final class QueryResult {
    private final StatusRecord status;
    private final Duration roundTrip;
}
