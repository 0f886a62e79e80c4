package com.company.slr.util;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

public class TimeUtils {

    /**
     * Storage keeps UTC wall-clock timestamps ({@code timestamp without time zone}).
     */
    public static LocalDateTime toUtcDateTime(Instant instant) {
        if (instant == null) return null;
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    public static Instant fromUtcDateTime(LocalDateTime dateTime) {
        if (dateTime == null) return null;
        return dateTime.toInstant(ZoneOffset.UTC);
    }

    public static Instant truncateToMinute(long epochMillis) {
        return Instant.ofEpochSecond(Math.floorDiv(epochMillis, 60000L) * 60L);
    }

    public static Instant truncateToDay(Instant instant) {
        return instant.truncatedTo(ChronoUnit.DAYS);
    }

    /**
     * Weeks start on Monday, matching PostgreSQL {@code date_trunc('week', ...)}.
     */
    public static Instant truncateToWeek(Instant instant) {
        LocalDate day = instant.atZone(ZoneOffset.UTC).toLocalDate()
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return day.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static String formatDuration(Duration duration) {
        if (duration == null) return null;

        long durationMs = duration.toMillis();
        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else if (seconds > 0) {
            return String.format("%ds", seconds);
        } else {
            return String.format("%dms", durationMs);
        }
    }
}
