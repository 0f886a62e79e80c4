package com.company.slr.source;

import com.company.slr.domain.Indicator;
import com.company.slr.domain.IndicatorValueAggregate;
import com.company.slr.domain.enums.Resolution;
import com.company.slr.time.TimeRange;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Backend access for one indicator. Instances are created per indicator by {@link SourceRegistry}.
 */
public sealed interface Source permits ZmonSource, LightstepSource {

    Indicator getIndicator();

    /**
     * Raw values in ascending timestamp order. Paged when both {@code page} and
     * {@code perPage} are given, unpaged otherwise.
     *
     * @param resolutionSeconds backend resolution; ignored by backends that store minute values
     */
    IndicatorValues getIndicatorValues(TimeRange timerange, Integer resolutionSeconds,
                                       Integer page, Integer perPage);

    default IndicatorValues getIndicatorValues(TimeRange timerange) {
        return getIndicatorValues(timerange, null, null, null);
    }

    /**
     * Read path for reporting. {@link Resolution#TOTAL} maps to at most one aggregate.
     */
    Map<Resolution, List<IndicatorValueAggregate>> getIndicatorValueAggregates(
            TimeRange timerange, Set<Resolution> resolutions);

    /**
     * Write path used by the updater.
     *
     * @return number of values written; 0 for backends that compute values on read
     */
    int updateIndicatorValues(TimeRange timerange);
}
