package com.company.slr;

import com.company.slr.domain.Indicator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

public final class Fixtures {

    public static final Instant NOW = Instant.parse("2024-01-10T12:00:00Z");

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private Fixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonNode json(String name) {
        try {
            return MAPPER.readTree(read(name));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Indicator indicator(long id, String name, Map<String, Object> source) {
        return Indicator.builder()
                .id(id)
                .productId(1L)
                .productName("checkout")
                .name(name)
                .slug(name)
                .unit("ms")
                .source(source)
                .build();
    }

    public static Map<String, Object> zmonSource(String aggregationType) {
        return Map.of(
                "type", "zmon",
                "check_id", 1234,
                "keys", List.of("requests.latency"),
                "aggregation", Map.of("type", aggregationType));
    }
}
