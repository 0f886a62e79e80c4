package com.company.slr.source.zmon;

import com.company.slr.config.SlrProperties;
import com.company.slr.domain.Indicator;
import com.company.slr.repository.IndicatorValueRepository;
import com.company.slr.source.Source;
import com.company.slr.source.SourceFactory;
import com.company.slr.source.ZmonSource;
import io.opentelemetry.api.trace.Tracer;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

@Component
@Order(1)
@RequiredArgsConstructor
public class ZmonSourceFactory implements SourceFactory {

    public static final String TYPE = "zmon";

    private final KairosDbClient kairosDbClient;
    private final IndicatorValueRepository valueRepository;
    private final SlrProperties properties;
    private final Clock clock;
    private final Tracer tracer;

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void validateConfig(Map<String, Object> config) {
        ZmonSourceConfig.validate(config);
    }

    @Override
    public Source create(Indicator indicator, Map<String, Object> config) {
        return new ZmonSource(indicator, ZmonSourceConfig.from(config), kairosDbClient, valueRepository,
                properties.getUpdater().getMaxQueryTimeSliceMinutes(), clock, tracer);
    }
}
