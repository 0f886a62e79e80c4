package com.company.slr.source.lightstep;

import com.company.slr.config.SlrProperties;
import com.company.slr.exception.BackendAuthException;
import com.company.slr.exception.BackendTransportException;
import com.company.slr.exception.SourceException;
import com.company.slr.time.DatetimeRange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightstep public API: timeseries of a saved search (stream).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LightstepClient {

    static final String TIMESERIES_PATH =
            "/public/v0.1/{organization}/projects/{project}/searches/{streamId}/timeseries";

    @Qualifier("lightstepRestTemplate")
    private final RestTemplate restTemplate;

    private final SlrProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * @throws BackendAuthException      on 401
     * @throws SourceException           when the response carries a non-empty {@code errors} array
     * @throws BackendTransportException on other HTTP failures, timeouts or malformed bodies
     */
    public JsonNode fetchTimeseries(String streamId, DatetimeRange window, int resolutionSeconds,
                                    Map<String, String> metricParams) {
        SlrProperties.Lightstep lightstep = properties.getLightstep();

        StringBuilder url = new StringBuilder(TIMESERIES_PATH)
                .append("?oldest-time={oldest}&youngest-time={youngest}&resolution-ms={resolution}");

        Map<String, Object> variables = new HashMap<>();
        variables.put("organization", lightstep.getOrganization());
        variables.put("project", lightstep.getProject());
        variables.put("streamId", streamId);
        variables.put("oldest", window.getStart().toString());
        variables.put("youngest", window.getEnd().toString());
        variables.put("resolution", String.valueOf(resolutionSeconds * 1000L));

        int i = 0;
        for (Map.Entry<String, String> param : metricParams.entrySet()) {
            String variable = "param" + i++;
            url.append('&').append(param.getKey()).append("={").append(variable).append('}');
            variables.put(variable, param.getValue());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (lightstep.getApiKey() != null && !lightstep.getApiKey().isEmpty()) {
            headers.setBearerAuth(lightstep.getApiKey());
        }

        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url.toString(), HttpMethod.GET, new HttpEntity<>(headers), String.class, variables);
            body = response.getBody();
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                throw new BackendAuthException("Given Lightstep API key is probably wrong. "
                        + "Please verify that slr.lightstep.api-key contains a valid key.", e);
            }
            JsonNode errorBody = tryParse(e.getResponseBodyAsString());
            if (errorBody != null) {
                checkErrors(errorBody);
            }
            throw new BackendTransportException(
                    "Lightstep request failed with status " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new BackendTransportException("Lightstep request failed: " + e.getMessage(), e);
        }

        JsonNode root = tryParse(body);
        if (root == null) {
            throw new BackendTransportException("Lightstep returned a malformed body");
        }
        checkErrors(root);

        log.debug("Fetched Lightstep timeseries for stream {} from {} to {}",
                streamId, window.getStart(), window.getEnd());
        return root;
    }

    private void checkErrors(JsonNode root) {
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new SourceException("Something went wrong with a request to the Lightstep API: " + errors + ".");
        }
    }

    private JsonNode tryParse(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable Lightstep body: {}", e.getOriginalMessage());
            return null;
        }
    }
}
