package com.company.slr.config;

import com.company.slr.repository.IndicatorRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final IndicatorRepository indicatorRepository;

    @Bean
    public MeterBinder indicatorMetrics() {
        return (reg) -> {
            Gauge.builder("slr.indicators.active", indicatorRepository, repo -> {
                        try {
                            return repo.countActive();
                        } catch (Exception e) {
                            log.warn("Failed to count active indicators", e);
                            return 0;
                        }
                    })
                    .description("Number of indicators that are not soft-deleted")
                    .register(reg);

            log.info("Indicator metrics registered");
        };
    }
}
