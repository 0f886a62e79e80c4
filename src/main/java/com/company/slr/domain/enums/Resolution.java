package com.company.slr.domain.enums;

import com.company.slr.util.TimeUtils;

import java.time.Instant;

public enum Resolution {
    DAY(86400),
    WEEK(7 * 86400),
    /**
     * The whole requested window as a single bucket.
     */
    TOTAL(0);

    private final int seconds;

    Resolution(int seconds) {
        this.seconds = seconds;
    }

    public int getSeconds() {
        return seconds;
    }

    public boolean isCalendarUnit() {
        return this != TOTAL;
    }

    public Instant truncate(Instant timestamp) {
        return switch (this) {
            case DAY -> TimeUtils.truncateToDay(timestamp);
            case WEEK -> TimeUtils.truncateToWeek(timestamp);
            case TOTAL -> throw new IllegalStateException("TOTAL has no calendar bucket");
        };
    }
}
