package com.company.slr.source;

import com.company.slr.aggregation.IndicatorValueAggregator;
import com.company.slr.domain.Indicator;
import com.company.slr.domain.IndicatorValue;
import com.company.slr.domain.IndicatorValueAggregate;
import com.company.slr.domain.enums.Resolution;
import com.company.slr.source.lightstep.LightstepClient;
import com.company.slr.source.lightstep.LightstepMetric;
import com.company.slr.source.lightstep.TimeRangePaginator;
import com.company.slr.time.TimeRange;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Lightstep stream metrics, computed by the backend on every read. Nothing is stored.
 */
public final class LightstepSource implements Source {

    private final Indicator indicator;
    private final String streamId;
    private final LightstepMetric metric;
    private final LightstepClient client;
    private final int defaultResolutionSeconds;
    private final Clock clock;

    public LightstepSource(Indicator indicator, String streamId, LightstepMetric metric,
                           LightstepClient client, int defaultResolutionSeconds, Clock clock) {
        this.indicator = indicator;
        this.streamId = streamId;
        this.metric = metric;
        this.client = client;
        this.defaultResolutionSeconds = defaultResolutionSeconds;
        this.clock = clock;
    }

    @Override
    public Indicator getIndicator() {
        return indicator;
    }

    public String getStreamId() {
        return streamId;
    }

    public LightstepMetric getMetric() {
        return metric;
    }

    @Override
    public IndicatorValues getIndicatorValues(TimeRange timerange, Integer resolutionSeconds,
                                              Integer page, Integer perPage) {
        return fetch(timerange, resolutionSeconds, page, perPage, clock.instant());
    }

    /**
     * Day and week buckets are computed by Lightstep at that resolution, one point per
     * bucket. The total is aggregated from points at the default resolution.
     */
    @Override
    public Map<Resolution, List<IndicatorValueAggregate>> getIndicatorValueAggregates(
            TimeRange timerange, Set<Resolution> resolutions) {

        Instant now = clock.instant();
        Map<Resolution, List<IndicatorValueAggregate>> result = new EnumMap<>(Resolution.class);

        for (Resolution resolution : resolutions) {
            if (resolution.isCalendarUnit()) {
                List<IndicatorValue> points =
                        fetch(timerange, resolution.getSeconds(), null, null, now).getValues();
                result.put(resolution, points.stream().map(IndicatorValueAggregator::fromValue).toList());
            } else {
                List<IndicatorValue> points = fetch(timerange, null, null, null, now).getValues();
                result.put(resolution,
                        IndicatorValueAggregator.aggregate(points, resolution, indicator.getAggregationType()));
            }
        }
        return result;
    }

    @Override
    public int updateIndicatorValues(TimeRange timerange) {
        return 0;
    }

    private IndicatorValues fetch(TimeRange timerange, Integer resolutionSeconds, Integer page, Integer perPage,
                                  Instant now) {
        int resolution = resolutionSeconds != null ? resolutionSeconds : defaultResolutionSeconds;

        TimeRangePaginator.Page window = TimeRangePaginator.paginate(timerange, resolution, page, perPage, now);
        JsonNode response = client.fetchTimeseries(streamId, window.getWindow(), resolution, metric.requestParams());

        return new IndicatorValues(metric.fromResponse(response, resolution), window.getPagination());
    }
}
