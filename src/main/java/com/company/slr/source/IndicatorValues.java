package com.company.slr.source;

import com.company.slr.domain.IndicatorValue;
import lombok.Value;

import java.util.List;

@Value
public class IndicatorValues {

    // Ascending by timestamp
    List<IndicatorValue> values;

    // Null for unpaged reads
    Pagination pagination;

    public static IndicatorValues unpaged(List<IndicatorValue> values) {
        return new IndicatorValues(values, null);
    }
}
