package com.company.slr.time;

import java.time.Duration;
import java.time.Instant;

/**
 * A query interval, either relative to "now" or absolute.
 *
 * <p>Every conversion takes {@code now} explicitly. An open-ended range resolved twice with
 * two different instants yields two different windows, so callers that need a stable window
 * (an update cycle, a report) read their clock once and pass that instant everywhere.
 */
public interface TimeRange {

    /**
     * Lower bound used for ranges without a start.
     */
    Instant MIN_INSTANT = Instant.parse("0001-01-01T00:00:00Z");

    RelativeMinutesRange toRelativeMinutes(Instant now);

    /**
     * Resolves both bounds: a missing start becomes {@link #MIN_INSTANT}, a missing end
     * becomes {@code now}.
     */
    DatetimeRange toDatetimes(Instant now);

    default long deltaSeconds(Instant now) {
        DatetimeRange resolved = toDatetimes(now);
        return Duration.between(resolved.getStart(), resolved.getEnd()).getSeconds();
    }
}
