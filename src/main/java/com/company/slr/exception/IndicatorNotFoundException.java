package com.company.slr.exception;

public class IndicatorNotFoundException extends RuntimeException {
    public IndicatorNotFoundException(long indicatorId) {
        super("Indicator not found: " + indicatorId);
    }
}
