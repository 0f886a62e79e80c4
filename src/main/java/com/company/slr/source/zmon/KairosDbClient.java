package com.company.slr.source.zmon;

import com.company.slr.config.SlrProperties;
import com.company.slr.exception.BackendAuthException;
import com.company.slr.exception.BackendTransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * KairosDB datapoint queries for ZMON check metrics, behind a circuit breaker.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KairosDbClient {

    static final String QUERY_PATH = "/api/v1/datapoints/query";

    @Qualifier("kairosDbRestTemplate")
    private final RestTemplate restTemplate;

    @Qualifier("kairosDbCircuitBreaker")
    private final CircuitBreaker circuitBreaker;

    private final SlrProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Builds the query body: metric {@code <namespace>.check.<checkId>}, filtered by key tags
     * and grouped by {@code entity} and {@code key}.
     *
     * @param endMinutes omitted from the body when 0
     */
    public ObjectNode buildQuery(ZmonSourceConfig config, int startMinutes, int endMinutes) {
        SlrProperties.KairosDb kairosDb = properties.getKairosdb();

        ObjectNode query = objectMapper.createObjectNode();
        query.set("start_relative", relative(startMinutes));
        if (endMinutes > 0) {
            query.set("end_relative", relative(endMinutes));
        }

        ObjectNode tags = objectMapper.createObjectNode();
        tags.set("key", objectMapper.valueToTree(config.queryKeys()));
        for (Map.Entry<String, Object> tag : config.getTags().entrySet()) {
            tags.set(tag.getKey(), objectMapper.valueToTree(tag.getValue()));
        }

        ObjectNode groupBy = objectMapper.createObjectNode();
        groupBy.put("name", "tag");
        groupBy.set("tags", objectMapper.valueToTree(List.of("entity", "key")));

        ObjectNode metric = query.putArray("metrics").addObject();
        metric.put("name", kairosDb.getMetricNamespace() + ".check." + config.getCheckId());
        metric.set("tags", tags);
        metric.put("limit", kairosDb.getQueryLimit());
        metric.putArray("group_by").add(groupBy);

        return query;
    }

    /**
     * Runs a query and returns {@code queries[0].results}.
     *
     * @throws BackendAuthException      on 401
     * @throws BackendTransportException on any other HTTP failure, timeout, open circuit or
     *                                   malformed body
     */
    public ArrayNode query(ObjectNode query) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String token = properties.getKairosdb().getToken();
        if (token != null && !token.isEmpty()) {
            headers.setBearerAuth(token);
        }
        HttpEntity<String> request = new HttpEntity<>(query.toString(), headers);

        String body;
        try {
            body = circuitBreaker.executeSupplier(
                    () -> restTemplate.postForObject(QUERY_PATH, request, String.class));
        } catch (CallNotPermittedException e) {
            throw new BackendTransportException("KairosDB circuit breaker is open, skipping query", e);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                throw new BackendAuthException("KairosDB rejected the token, check slr.kairosdb.token", e);
            }
            throw new BackendTransportException(
                    "KairosDB query failed with status " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new BackendTransportException("KairosDB query failed: " + e.getMessage(), e);
        }

        return parseResults(body);
    }

    private ArrayNode parseResults(String body) {
        if (body == null) {
            throw new BackendTransportException("KairosDB returned an empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BackendTransportException("KairosDB returned a malformed body", e);
        }

        JsonNode results = root.path("queries").path(0).path("results");
        if (!results.isArray()) {
            throw new BackendTransportException("KairosDB response has no queries[0].results");
        }

        log.debug("KairosDB returned {} result groups", results.size());
        return (ArrayNode) results;
    }

    private ObjectNode relative(int minutes) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("value", minutes);
        node.put("unit", "minutes");
        return node;
    }
}
