package com.company.slr.source.zmon;

import com.company.slr.domain.enums.AggregationType;
import com.company.slr.exception.SourceException;
import lombok.Value;

import java.util.*;

/**
 * Parsed ZMON source parameters of an indicator.
 */
@Value
public class ZmonSourceConfig {

    static final List<String> REQUIRED_KEYS = List.of("aggregation", "check_id", "keys");

    String checkId;
    List<String> keys;
    AggregationType aggregationType;
    List<String> weightKeys;
    List<String> excludeKeys;
    Map<String, Object> tags;

    public static void validate(Map<String, Object> config) {
        Set<String> missing = new TreeSet<>(REQUIRED_KEYS);
        missing.removeAll(config.keySet());
        if (!missing.isEmpty()) {
            throw new SourceException("SLI 'source' has missing keys: " + missing + "!");
        }

        if (isEmpty(config.get("keys"))) {
            throw new SourceException("SLI 'source' *keys* must have a value");
        }

        Map<?, ?> aggregation = config.get("aggregation") instanceof Map<?, ?> agg ? agg : Map.of();
        if (aggregation.isEmpty()) {
            throw new SourceException("SLI 'source' *aggregation* must have a value");
        }

        Object type = aggregation.get("type");
        Optional<AggregationType> aggregationType =
                AggregationType.fromString(type == null ? null : type.toString());
        if (aggregationType.isEmpty()) {
            throw new SourceException("SLI 'source' aggregation type is invalid. Valid values are: "
                    + AggregationType.validNames());
        }

        if (aggregationType.get() == AggregationType.WEIGHTED && isEmpty(aggregation.get("weight_keys"))) {
            throw new SourceException("SLI 'source' aggregation type *weighted* must have *weight_keys*");
        }
    }

    public static ZmonSourceConfig from(Map<String, Object> config) {
        validate(config);

        Map<?, ?> aggregation = (Map<?, ?>) config.get("aggregation");
        AggregationType aggregationType = AggregationType.fromString(aggregation.get("type").toString())
                .orElseThrow();

        Map<String, Object> tags = new LinkedHashMap<>();
        if (config.get("tags") instanceof Map<?, ?> rawTags) {
            rawTags.forEach((k, v) -> tags.put(k.toString(), v));
        }

        return new ZmonSourceConfig(
                config.get("check_id").toString(),
                stringList(config.get("keys")),
                aggregationType,
                stringList(aggregation.get("weight_keys")),
                stringList(config.get("exclude_keys")),
                tags);
    }

    /**
     * Keys to request from KairosDB: value keys plus weight keys.
     */
    public List<String> queryKeys() {
        List<String> all = new ArrayList<>(keys);
        all.addAll(weightKeys);
        return all;
    }

    private static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return value.toString().isEmpty();
    }

    private static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> c) {
            return c.stream().map(Object::toString).toList();
        }
        return List.of(value.toString());
    }
}
