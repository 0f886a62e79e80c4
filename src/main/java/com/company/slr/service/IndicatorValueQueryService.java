package com.company.slr.service;

import com.company.slr.config.SlrProperties;
import com.company.slr.domain.Indicator;
import com.company.slr.domain.IndicatorValueAggregate;
import com.company.slr.domain.enums.Resolution;
import com.company.slr.exception.IndicatorNotFoundException;
import com.company.slr.exception.InvalidTimeRangeException;
import com.company.slr.repository.IndicatorRepository;
import com.company.slr.repository.IndicatorValueRepository;
import com.company.slr.source.IndicatorValues;
import com.company.slr.source.Source;
import com.company.slr.source.SourceRegistry;
import com.company.slr.time.DatetimeRange;
import com.company.slr.time.RelativeMinutesRange;
import com.company.slr.time.TimeRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read path over indicator values plus on-demand backfill. Errors propagate to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndicatorValueQueryService {

    public static final int DEFAULT_WINDOW_MINUTES = 10080;

    private final IndicatorRepository indicatorRepository;
    private final IndicatorValueRepository valueRepository;
    private final SourceRegistry sourceRegistry;
    private final SlrProperties properties;
    private final Clock clock;

    /**
     * Values of a live indicator. An explicit {@code fromMinutes} returns the whole window
     * unpaged; otherwise the last 7 days are browsed page by page,
     * starting at page 1 for a missing or non-positive page.
     */
    public IndicatorValues listValues(long indicatorId, Integer fromMinutes, Integer toMinutes,
                                      Integer page, Integer pageSize) {
        Indicator indicator = findLiveIndicator(indicatorId);

        DatetimeRange window = resolve(RelativeMinutesRange.of(
                fromMinutes != null ? fromMinutes : DEFAULT_WINDOW_MINUTES, toMinutes));

        Source source = sourceRegistry.fromIndicator(indicator);
        if (fromMinutes != null) {
            return source.getIndicatorValues(window);
        }

        // Out-of-range paging falls back to the first page and the default size
        int pageNumber = page != null ? Math.max(page, 1) : 1;
        int perPage = pageSize != null && pageSize > 0 ? pageSize : properties.getApi().getDefaultPageSize();
        return source.getIndicatorValues(window, null, pageNumber, perPage);
    }

    /**
     * Fetches and persists values for {@code [now - start, now - end]} minutes.
     *
     * @return number of values written
     */
    public int queryAndPersist(long indicatorId, Integer start, Integer end) {
        int endMinutes = end != null ? end : 0;
        if (start == null || start <= 0) {
            throw new InvalidTimeRangeException("Query 'start' must have a value!");
        }
        if (start < endMinutes) {
            throw new InvalidTimeRangeException("Query 'start' must be greater than 'end'");
        }

        Indicator indicator = findLiveIndicator(indicatorId);
        log.info("Querying indicator {} values for product {} from {} to {} minutes ago",
                indicator.getName(), indicator.getProductName(), start, endMinutes);

        return sourceRegistry.fromIndicator(indicator)
                .updateIndicatorValues(new RelativeMinutesRange(start, endMinutes));
    }

    public Map<Resolution, List<IndicatorValueAggregate>> getAggregates(long indicatorId, Integer fromMinutes,
                                                                        Set<Resolution> resolutions) {
        Indicator indicator = findLiveIndicator(indicatorId);
        DatetimeRange window = resolve(RelativeMinutesRange.of(
                fromMinutes != null ? fromMinutes : DEFAULT_WINDOW_MINUTES, 0));

        return sourceRegistry.fromIndicator(indicator).getIndicatorValueAggregates(window, resolutions);
    }

    /**
     * Deletes the stored values of all indicators in {@code [start, end]}.
     */
    public int purgeValues(TimeRange timerange) {
        DatetimeRange window = timerange.toDatetimes(clock.instant());
        int count = valueRepository.deleteBetween(window.getStart(), window.getEnd());
        log.info("Purged {} indicator values between {} and {}", count, window.getStart(), window.getEnd());
        return count;
    }

    private Indicator findLiveIndicator(long indicatorId) {
        return indicatorRepository.findById(indicatorId)
                .filter(indicator -> !indicator.isDeleted())
                .orElseThrow(() -> new IndicatorNotFoundException(indicatorId));
    }

    private DatetimeRange resolve(RelativeMinutesRange range) {
        DatetimeRange window = range.toDatetimes(clock.instant());
        if (window.getStart().isAfter(window.getEnd())) {
            throw new InvalidTimeRangeException("Query filters 'from' should be greater than 'to'");
        }
        return window;
    }
}
