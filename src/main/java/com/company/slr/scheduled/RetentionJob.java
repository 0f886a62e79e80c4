package com.company.slr.scheduled;

import com.company.slr.service.RetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily purge of deleted indicators and expired values.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "slr.retention.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class RetentionJob {

    private final RetentionService retentionService;

    @Scheduled(cron = "${slr.retention.cron:0 0 3 * * *}")
    public void runRetention() {
        log.info("Starting retention job");

        int indicators = retentionService.cleanupDeletedIndicators();
        int values = retentionService.applyRetention();

        log.info("Retention job finished: {} indicators, {} values deleted", indicators, values);
    }
}
