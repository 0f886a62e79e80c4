package com.company.slr.source.lightstep;

import com.company.slr.source.Pagination;
import com.company.slr.time.DatetimeRange;
import com.company.slr.time.TimeRange;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Splits a time range into pages of {@code perPage} backend buckets.
 */
public final class TimeRangePaginator {

    private TimeRangePaginator() {
    }

    @Value
    public static class Page {
        DatetimeRange window;

        // Null when no paging was requested
        Pagination pagination;
    }

    /**
     * Page {@code page} starts {@code (page - 1) * perPage} buckets after the range start and
     * spans {@code perPage} buckets. Without paging the whole range is returned. Either way a
     * window that is not a whole number of buckets gets its end extended to the next bucket.
     */
    public static Page paginate(TimeRange timerange, int resolutionSeconds, Integer page, Integer perPage,
                                Instant now) {
        DatetimeRange range = timerange.toDatetimes(now);

        if (page == null || perPage == null) {
            return new Page(alignEnd(range, resolutionSeconds), null);
        }

        long rangeSeconds = Duration.between(range.getStart(), range.getEnd()).getSeconds();
        long totalBuckets = (rangeSeconds + resolutionSeconds - 1) / resolutionSeconds;

        Instant start = range.getStart().plusSeconds((long) (page - 1) * perPage * resolutionSeconds);
        Instant end = start.plusSeconds((long) perPage * resolutionSeconds);

        return new Page(new DatetimeRange(start, end), Pagination.of(page, perPage, totalBuckets));
    }

    static DatetimeRange alignEnd(DatetimeRange range, int resolutionSeconds) {
        long rangeSeconds = Duration.between(range.getStart(), range.getEnd()).getSeconds();
        long remainder = rangeSeconds % resolutionSeconds;
        if (remainder == 0) {
            return range;
        }
        return new DatetimeRange(range.getStart(), range.getEnd().plusSeconds(resolutionSeconds - remainder));
    }
}
