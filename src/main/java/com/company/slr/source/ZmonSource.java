package com.company.slr.source;

import com.company.slr.aggregation.IndicatorValueAggregator;
import com.company.slr.domain.Indicator;
import com.company.slr.domain.IndicatorValue;
import com.company.slr.domain.IndicatorValueAggregate;
import com.company.slr.domain.enums.Resolution;
import com.company.slr.repository.IndicatorValueRepository;
import com.company.slr.source.zmon.KairosDbClient;
import com.company.slr.source.zmon.MinuteValueAggregator;
import com.company.slr.source.zmon.ZmonSourceConfig;
import com.company.slr.time.DatetimeRange;
import com.company.slr.time.RelativeMinutesRange;
import com.company.slr.time.TimeRange;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * ZMON check data from KairosDB, materialized as one stored value per minute.
 *
 * <p>Reads come from storage only. Updates fetch from KairosDB, aggregate per minute and
 * upsert the whole batch in one transaction once the fetch has completed.
 */
@Slf4j
public final class ZmonSource implements Source {

    // Overlap with the newest stored value, for late-arriving data
    static final int UPDATE_OVERLAP_MINUTES = 5;

    private final Indicator indicator;
    private final ZmonSourceConfig config;
    private final KairosDbClient kairosDbClient;
    private final IndicatorValueRepository valueRepository;
    private final int maxQueryTimeSliceMinutes;
    private final Clock clock;
    private final Tracer tracer;

    public ZmonSource(Indicator indicator, ZmonSourceConfig config, KairosDbClient kairosDbClient,
                      IndicatorValueRepository valueRepository, int maxQueryTimeSliceMinutes,
                      Clock clock, Tracer tracer) {
        this.indicator = indicator;
        this.config = config;
        this.kairosDbClient = kairosDbClient;
        this.valueRepository = valueRepository;
        this.maxQueryTimeSliceMinutes = maxQueryTimeSliceMinutes;
        this.clock = clock;
        this.tracer = tracer;
    }

    @Override
    public Indicator getIndicator() {
        return indicator;
    }

    public ZmonSourceConfig getConfig() {
        return config;
    }

    @Override
    public IndicatorValues getIndicatorValues(TimeRange timerange, Integer resolutionSeconds,
                                              Integer page, Integer perPage) {
        DatetimeRange window = timerange.toDatetimes(clock.instant());

        if (page == null || perPage == null) {
            return IndicatorValues.unpaged(
                    valueRepository.findValues(indicator.getId(), window.getStart(), window.getEnd()));
        }

        List<IndicatorValue> values = valueRepository.findValuesPage(
                indicator.getId(), window.getStart(), window.getEnd(), page, perPage);
        long total = valueRepository.countValues(indicator.getId(), window.getStart(), window.getEnd());

        return new IndicatorValues(values, Pagination.of(page, perPage, total));
    }

    @Override
    public Map<Resolution, List<IndicatorValueAggregate>> getIndicatorValueAggregates(
            TimeRange timerange, Set<Resolution> resolutions) {

        List<IndicatorValue> values = getIndicatorValues(timerange).getValues();

        Map<Resolution, List<IndicatorValueAggregate>> result = new EnumMap<>(Resolution.class);
        for (Resolution resolution : resolutions) {
            result.put(resolution,
                    IndicatorValueAggregator.aggregate(values, resolution, indicator.getAggregationType()));
        }
        return result;
    }

    @Override
    public int updateIndicatorValues(TimeRange timerange) {
        Instant now = clock.instant();
        RelativeMinutesRange relative = timerange.toRelativeMinutes(now);

        int start = relative.getStart() != null ? relative.getStart() : startRelativeForUpdate(now);
        int end = relative.getEnd();

        ArrayNode results = kairosDbClient.query(kairosDbClient.buildQuery(config, start, end));
        SortedMap<Instant, Double> minutes = MinuteValueAggregator.aggregate(results, config);

        if (minutes.isEmpty()) {
            log.debug("No KairosDB values for indicator {} in the last {} minutes", indicator.getName(), start);
            return 0;
        }

        SortedMap<Instant, Double> clamped = new TreeMap<>();
        minutes.forEach((minute, value) -> clamped.put(minute, MinuteValueAggregator.clamp(value)));

        return upsert(clamped);
    }

    /**
     * Minutes to look back: since the newest stored value plus an overlap, or the whole
     * query slice when nothing was stored within it.
     */
    int startRelativeForUpdate(Instant now) {
        Instant sliceStart = now.minus(Duration.ofMinutes(maxQueryTimeSliceMinutes));

        return valueRepository.findNewestTimestamp(indicator.getId(), sliceStart, now)
                .map(newest -> (int) Duration.between(newest, now).toMinutes() + UPDATE_OVERLAP_MINUTES)
                .orElse(maxQueryTimeSliceMinutes);
    }

    private int upsert(SortedMap<Instant, Double> values) {
        Span span = tracer.spanBuilder("indicator.values.upsert")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("indicator", indicator.getName());
            span.setAttribute("indicator.id", indicator.getId());
            span.setAttribute("result_count", values.size());

            return valueRepository.upsertAll(indicator.getId(), values);
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to upsert indicator values");
            throw e;
        } finally {
            span.end();
        }
    }
}
