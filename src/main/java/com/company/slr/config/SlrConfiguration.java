package com.company.slr.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
@EnableConfigurationProperties(SlrProperties.class)
public class SlrConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for per-indicator update tasks, owned by the application context.
     */
    @Bean(destroyMethod = "shutdown")
    @Qualifier("indicatorUpdaterExecutor")
    public ExecutorService indicatorUpdaterExecutor(SlrProperties properties) {
        int concurrency = properties.getUpdater().getConcurrency();
        log.info("Creating indicator updater pool with {} workers", concurrency);
        return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("sli-updater-"));
    }

    @Bean
    @Qualifier("kairosDbRestTemplate")
    public RestTemplate kairosDbRestTemplate(RestTemplateBuilder builder, SlrProperties properties) {
        Duration timeout = properties.getKairosdb().getTimeout();
        return builder
                .rootUri(properties.getKairosdb().getUrl())
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    @Qualifier("lightstepRestTemplate")
    public RestTemplate lightstepRestTemplate(RestTemplateBuilder builder, SlrProperties properties) {
        Duration timeout = properties.getLightstep().getTimeout();
        return builder
                .rootUri(properties.getLightstep().getBaseUrl())
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(timeout)
                .build();
    }

    /**
     * The breaker is shared by all indicators, so only failures of the backend itself count:
     * timeouts, connection errors and 5xx. A 4xx answers one indicator's query (bad check,
     * bad token) and must not open the circuit for the others.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .waitDurationInOpenState(Duration.ofMinutes(2))
                .recordExceptions(ResourceAccessException.class, HttpServerErrorException.class)
                .ignoreExceptions(HttpClientErrorException.class)
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    @Qualifier("kairosDbCircuitBreaker")
    public CircuitBreaker kairosDbCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("kairosdb");
    }
}
