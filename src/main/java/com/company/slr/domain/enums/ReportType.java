package com.company.slr.domain.enums;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

public enum ReportType {
    WEEKLY(Resolution.DAY),
    MONTHLY(Resolution.WEEK),
    QUARTERLY(Resolution.WEEK);

    private final Resolution resolution;

    ReportType(Resolution resolution) {
        this.resolution = resolution;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public Instant periodStart(Instant now) {
        var utc = now.atZone(ZoneOffset.UTC);
        return switch (this) {
            case WEEKLY -> utc.minusDays(7).toInstant();
            case MONTHLY -> utc.minusMonths(1).toInstant();
            case QUARTERLY -> utc.minusMonths(3).toInstant();
        };
    }

    public static Optional<ReportType> fromString(String type) {
        if (type == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(ReportType.valueOf(type.toUpperCase()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
