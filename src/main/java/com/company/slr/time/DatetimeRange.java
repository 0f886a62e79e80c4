package com.company.slr.time;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Absolute range; either bound may be null until resolved.
 */
@Value
public class DatetimeRange implements TimeRange {

    Instant start;
    Instant end;

    @Override
    public RelativeMinutesRange toRelativeMinutes(Instant now) {
        Integer startMinutes = start == null ? null : minutesBefore(start, now);
        int endMinutes = end == null ? 0 : minutesBefore(end, now);
        return new RelativeMinutesRange(startMinutes, endMinutes);
    }

    @Override
    public DatetimeRange toDatetimes(Instant now) {
        if (start != null && end != null) {
            return this;
        }
        return new DatetimeRange(start == null ? MIN_INSTANT : start, end == null ? now : end);
    }

    private static int minutesBefore(Instant instant, Instant now) {
        return (int) Math.max(0, Duration.between(instant, now).toMinutes());
    }
}
