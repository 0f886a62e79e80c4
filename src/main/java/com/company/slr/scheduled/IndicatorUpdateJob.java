package com.company.slr.scheduled;

import com.company.slr.service.IndicatorUpdater;
import com.company.slr.service.UpdateCycleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs an update cycle, then sleeps for the configured interval.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "slr.updater.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class IndicatorUpdateJob {

    private final IndicatorUpdater indicatorUpdater;

    @Scheduled(fixedDelayString = "${slr.updater.interval-ms:600000}")
    public void updateIndicators() {
        UpdateCycleResult result = indicatorUpdater.runCycle();

        if (result.isSkipped()) {
            log.debug("Update cycle skipped");
            return;
        }
        if (result.getFailed() > 0) {
            log.warn("Update cycle finished with {} failed indicators out of {}",
                    result.getFailed(), result.getIndicators());
        }
    }
}
