package com.company.slr.service;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class UpdateCycleResult {

    // True when another cycle was running or a stop was requested
    boolean skipped;

    int indicators;
    int succeeded;
    int failed;

    // Values written across all indicators
    long values;

    Duration duration;

    public static UpdateCycleResult skippedCycle() {
        return UpdateCycleResult.builder().skipped(true).duration(Duration.ZERO).build();
    }
}
