package com.company.slr.time;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Minutes before "now". {@code start} may be null, meaning the consumer picks the start.
 */
@Value
public class RelativeMinutesRange implements TimeRange {

    Integer start;
    int end;

    public static RelativeMinutesRange of(Integer start, Integer end) {
        return new RelativeMinutesRange(start, end == null ? 0 : end);
    }

    /**
     * No start, ending now: sources decide how far back to look.
     */
    public static RelativeMinutesRange open() {
        return new RelativeMinutesRange(null, 0);
    }

    @Override
    public RelativeMinutesRange toRelativeMinutes(Instant now) {
        return this;
    }

    @Override
    public DatetimeRange toDatetimes(Instant now) {
        Instant startInstant = start == null ? MIN_INSTANT : now.minus(Duration.ofMinutes(start));
        return new DatetimeRange(startInstant, now.minus(Duration.ofMinutes(end)));
    }
}
