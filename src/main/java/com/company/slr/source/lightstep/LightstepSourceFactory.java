package com.company.slr.source.lightstep;

import com.company.slr.config.SlrProperties;
import com.company.slr.domain.Indicator;
import com.company.slr.exception.SourceException;
import com.company.slr.source.LightstepSource;
import com.company.slr.source.Source;
import com.company.slr.source.SourceFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

@Component
@Order(2)
@RequiredArgsConstructor
public class LightstepSourceFactory implements SourceFactory {

    public static final String TYPE = "lightstep";

    private final LightstepClient lightstepClient;
    private final SlrProperties properties;
    private final Clock clock;

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void validateConfig(Map<String, Object> config) {
        Object streamId = config.get("stream_id");
        if (streamId == null || streamId.toString().isEmpty()) {
            throw new SourceException("LightStep stream ID is required, but was not provided or is empty. "
                    + "Please provide a valid LightStep stream ID in the 'stream_id' property of the source configuration.");
        }

        String metric = String.valueOf(config.get("metric"));
        if (LightstepMetric.fromString(metric).isEmpty()) {
            throw new SourceException("Metric name for the LightStep source is not correct. "
                    + "Please provide a valid metric name in the 'metric' property of the source configuration. "
                    + "Current value is '" + metric + "' whereas the valid choices are: "
                    + String.join(", ", LightstepMetric.names()) + ".");
        }
    }

    @Override
    public Source create(Indicator indicator, Map<String, Object> config) {
        validateConfig(config);

        LightstepMetric metric = LightstepMetric.fromString(config.get("metric").toString()).orElseThrow();
        return new LightstepSource(indicator, config.get("stream_id").toString(), metric, lightstepClient,
                properties.getLightstep().getResolutionSeconds(), clock);
    }
}
