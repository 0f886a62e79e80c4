package com.company.slr.service;

import com.company.slr.Fixtures;
import com.company.slr.config.SlrProperties;
import com.company.slr.repository.IndicatorRepository;
import com.company.slr.repository.IndicatorValueRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetentionServiceTest {

    @Mock
    private IndicatorRepository indicatorRepository;

    @Mock
    private IndicatorValueRepository valueRepository;

    private SlrProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private RetentionService service;

    @BeforeEach
    void setUp() {
        properties = new SlrProperties();
        meterRegistry = new SimpleMeterRegistry();
        service = new RetentionService(indicatorRepository, valueRepository, properties, meterRegistry,
                Fixtures.fixedClock());
    }

    @Test
    @DisplayName("Values older than the retention period are deleted up to the exact cutoff")
    void applyRetention() {
        when(valueRepository.deleteAtOrBefore(Instant.parse("2023-10-02T12:00:00Z"))).thenReturn(250);

        assertThat(service.applyRetention()).isEqualTo(250);
        assertThat(meterRegistry.counter("slr.retention.deleted", "kind", "values").count()).isEqualTo(250.0);
    }

    @Test
    void configuredRetention() {
        properties.getRetention().setMaxRetentionDays(1);
        when(valueRepository.deleteAtOrBefore(Instant.parse("2024-01-09T12:00:00Z"))).thenReturn(0);

        assertThat(service.applyRetention()).isZero();
    }

    @Test
    @DisplayName("A failing job reports 0 and is counted")
    void failureIsContained() {
        when(valueRepository.deleteAtOrBefore(Instant.parse("2023-10-02T12:00:00Z")))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        when(indicatorRepository.deleteAllSoftDeleted()).thenReturn(2);

        assertThat(service.applyRetention()).isZero();
        assertThat(service.cleanupDeletedIndicators()).isEqualTo(2);

        assertThat(meterRegistry.counter("slr.retention.failures", "job", "values").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("slr.retention.deleted", "kind", "indicators").count()).isEqualTo(2.0);
    }

    @Test
    void cleanupFailure() {
        when(indicatorRepository.deleteAllSoftDeleted())
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(service.cleanupDeletedIndicators()).isZero();
        assertThat(meterRegistry.counter("slr.retention.failures", "job", "cleanup").count()).isEqualTo(1.0);
    }
}
