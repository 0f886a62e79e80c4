package com.company.slr.service;

import com.company.slr.config.SlrProperties;
import com.company.slr.repository.IndicatorRepository;
import com.company.slr.repository.IndicatorValueRepository;
import com.company.slr.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Keeps storage bounded. Both jobs are idempotent and log failures instead of throwing,
 * so one failing job never keeps the other from running.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetentionService {

    private final IndicatorRepository indicatorRepository;
    private final IndicatorValueRepository valueRepository;
    private final SlrProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Hard-deletes soft-deleted indicators that no target references anymore.
     *
     * @return number of indicators removed, 0 on failure
     */
    public int cleanupDeletedIndicators() {
        Instant start = clock.instant();
        try {
            int count = indicatorRepository.deleteAllSoftDeleted();

            meterRegistry.counter("slr.retention.deleted", "kind", "indicators").increment(count);
            log.info("Deleted SLIs: {} in {}", count,
                    TimeUtils.formatDuration(Duration.between(start, clock.instant())));
            return count;

        } catch (Exception e) {
            log.error("Failed to clean up deleted SLIs", e);
            meterRegistry.counter("slr.retention.failures", "job", "cleanup").increment();
            return 0;
        }
    }

    /**
     * Deletes values at or before {@code now - max-retention-days}.
     *
     * @return number of values removed, 0 on failure
     */
    public int applyRetention() {
        int retentionDays = properties.getRetention().getMaxRetentionDays();
        Instant start = clock.instant();
        Instant cutoff = start.minus(Duration.ofDays(retentionDays));

        try {
            int count = valueRepository.deleteAtOrBefore(cutoff);

            meterRegistry.counter("slr.retention.deleted", "kind", "values").increment(count);
            log.info("Deleted SLI values: {} up to {} in {}", count, cutoff,
                    TimeUtils.formatDuration(Duration.between(start, clock.instant())));
            return count;

        } catch (Exception e) {
            log.error("Failed to apply retention: {} days - {}", retentionDays, cutoff, e);
            meterRegistry.counter("slr.retention.failures", "job", "values").increment();
            return 0;
        }
    }
}
