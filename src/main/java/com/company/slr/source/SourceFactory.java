package com.company.slr.source;

import com.company.slr.domain.Indicator;

import java.util.Map;

/**
 * Validator and constructor for one backend type.
 */
public interface SourceFactory {

    /**
     * Value of the {@code type} key in an indicator's source config.
     */
    String type();

    /**
     * @throws com.company.slr.exception.SourceException when the config is unusable
     */
    void validateConfig(Map<String, Object> config);

    Source create(Indicator indicator, Map<String, Object> config);
}
