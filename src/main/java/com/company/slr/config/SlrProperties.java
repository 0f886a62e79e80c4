package com.company.slr.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "slr")
public class SlrProperties {

    @Valid
    private KairosDb kairosdb = new KairosDb();

    @Valid
    private Lightstep lightstep = new Lightstep();

    @Valid
    private Updater updater = new Updater();

    @Valid
    private Retention retention = new Retention();

    @Valid
    private Api api = new Api();

    @Data
    public static class KairosDb {
        @NotBlank
        private String url = "http://localhost:8083";

        private String token;

        @Min(1)
        private int queryLimit = 10000;

        @NotBlank
        private String metricNamespace = "zmon";

        @NotNull
        private Duration timeout = Duration.ofSeconds(55);
    }

    @Data
    public static class Lightstep {
        @NotBlank
        private String baseUrl = "https://api.lightstep.com";

        private String apiKey;

        @NotBlank
        private String organization = "Zalando";

        @NotBlank
        private String project = "Production";

        @Min(1)
        private int resolutionSeconds = 600;

        @NotNull
        private Duration timeout = Duration.ofSeconds(55);
    }

    @Data
    public static class Updater {
        private boolean enabled = true;

        // Keep small: the metric backends rate-limit us
        @Min(1)
        private int concurrency = 20;

        @Min(1000)
        private long intervalMs = 600000;

        @Min(1)
        private int maxQueryTimeSliceMinutes = 1440;
    }

    @Data
    public static class Retention {
        private boolean enabled = true;

        @NotBlank
        private String cron = "0 0 3 * * *";

        @Min(1)
        private int maxRetentionDays = 100;
    }

    @Data
    public static class Api {
        @Min(1)
        private int defaultPageSize = 100;
    }
}
