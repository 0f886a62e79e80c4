package com.company.slr.source;

import com.company.slr.Fixtures;
import com.company.slr.config.SlrProperties;
import com.company.slr.exception.SourceException;
import com.company.slr.repository.IndicatorValueRepository;
import com.company.slr.source.lightstep.LightstepClient;
import com.company.slr.source.lightstep.LightstepMetric;
import com.company.slr.source.lightstep.LightstepSourceFactory;
import com.company.slr.source.zmon.KairosDbClient;
import com.company.slr.source.zmon.ZmonSourceFactory;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

class SourceRegistryTest {

    private SourceRegistry registry;

    @BeforeEach
    void setUp() {
        SlrProperties properties = new SlrProperties();
        Clock clock = Fixtures.fixedClock();

        ZmonSourceFactory zmon = new ZmonSourceFactory(mock(KairosDbClient.class),
                mock(IndicatorValueRepository.class), properties, clock, OpenTelemetry.noop().getTracer("test"));
        LightstepSourceFactory lightstep = new LightstepSourceFactory(mock(LightstepClient.class), properties, clock);

        registry = new SourceRegistry(List.of(zmon, lightstep));
    }

    @Test
    @DisplayName("Unknown types are rejected with the valid choices")
    void unknownType() {
        Map<String, Object> config = Map.of("type", "prometheus", "query", "up");

        assertThatThrownBy(() -> registry.validateConfig(config))
                .isInstanceOf(SourceException.class)
                .hasMessage("Given source type 'prometheus' is not valid. Choose one from: [zmon, lightstep]");
    }

    @Test
    @DisplayName("Configs without a type are ZMON configs")
    void defaultsToZmon() {
        Map<String, Object> config = new HashMap<>(Fixtures.zmonSource("average"));
        config.remove("type");

        Source source = registry.fromIndicator(Fixtures.indicator(1L, "latency", config));

        assertThat(source).isInstanceOf(ZmonSource.class);
        assertThat(source.getIndicator().getName()).isEqualTo("latency");
    }

    @Test
    @DisplayName("Lightstep configs resolve to a Lightstep source")
    void lightstep() {
        Source source = registry.fromIndicator(Fixtures.indicator(2L, "errors",
                Map.of("type", "lightstep", "stream_id", "abc", "metric", "error-percentage")));

        assertThat(source).isInstanceOfSatisfying(LightstepSource.class, lightstep -> {
            assertThat(lightstep.getStreamId()).isEqualTo("abc");
            assertThat(lightstep.getMetric()).isEqualTo(LightstepMetric.ERROR_PERCENTAGE);
        });
    }

    @Test
    @DisplayName("Validation is delegated to the backend")
    void delegatesValidation() {
        assertThatThrownBy(() -> registry.validateConfig(Map.of("check_id", 1, "keys", List.of("a"))))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("missing keys");

        assertThatThrownBy(() -> registry.validateConfig(Map.of("type", "lightstep", "metric", "operation_count")))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("stream ID is required");

        assertThatCode(() -> registry.validateConfig(Fixtures.zmonSource("sum"))).doesNotThrowAnyException();
    }
}
