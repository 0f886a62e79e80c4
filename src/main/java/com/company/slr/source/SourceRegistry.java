package com.company.slr.source;

import com.company.slr.domain.Indicator;
import com.company.slr.exception.SourceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Resolves an indicator's {@code source.type} to its backend. Types without a
 * registered factory are rejected with the list of valid ones.
 */
@Component
@Slf4j
public class SourceRegistry {

    public static final String TYPE_KEY = "type";
    public static final String DEFAULT_TYPE = "zmon";

    private final Map<String, SourceFactory> factories = new LinkedHashMap<>();

    public SourceRegistry(List<SourceFactory> sourceFactories) {
        for (SourceFactory factory : sourceFactories) {
            factories.put(factory.type(), factory);
        }
        log.info("Registered indicator source types: {}", factories.keySet());
    }

    public List<String> validTypes() {
        return new ArrayList<>(factories.keySet());
    }

    /**
     * Validates a full source config, {@code type} included. Called before an indicator
     * config is persisted.
     */
    public void validateConfig(Map<String, Object> sourceConfig) {
        factoryFor(typeOf(sourceConfig)).validateConfig(withoutType(sourceConfig));
    }

    public Source fromIndicator(Indicator indicator) {
        Map<String, Object> sourceConfig = indicator.getSource() == null ? Map.of() : indicator.getSource();
        return factoryFor(typeOf(sourceConfig)).create(indicator, withoutType(sourceConfig));
    }

    private SourceFactory factoryFor(String type) {
        SourceFactory factory = factories.get(type);
        if (factory == null) {
            throw new SourceException(String.format(
                    "Given source type '%s' is not valid. Choose one from: %s", type, validTypes()));
        }
        return factory;
    }

    private static String typeOf(Map<String, Object> sourceConfig) {
        Object type = sourceConfig.get(TYPE_KEY);
        return type == null ? DEFAULT_TYPE : type.toString();
    }

    private static Map<String, Object> withoutType(Map<String, Object> sourceConfig) {
        Map<String, Object> config = new HashMap<>(sourceConfig);
        config.remove(TYPE_KEY);
        return config;
    }
}
