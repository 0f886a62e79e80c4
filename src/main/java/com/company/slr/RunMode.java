package com.company.slr;

import java.util.Arrays;
import java.util.Map;

/**
 * How the process runs: as a long-lived service, or one maintenance pass and exit.
 */
public enum RunMode {
    SERVICE(null),
    UPDATER_ONCE("--updater-once"),
    CLEANUP_ONLY("--cleanup-only");

    private final String flag;

    RunMode(String flag) {
        this.flag = flag;
    }

    public String getFlag() {
        return flag;
    }

    public boolean isOneShot() {
        return this != SERVICE;
    }

    public static RunMode fromArgs(String... args) {
        for (RunMode mode : values()) {
            if (mode.flag != null && Arrays.asList(args).contains(mode.flag)) {
                return mode;
            }
        }
        return SERVICE;
    }

    /**
     * One-shot modes run without the scheduled jobs and without a web server.
     */
    public Map<String, Object> defaultProperties() {
        if (!isOneShot()) {
            return Map.of();
        }
        return Map.of(
                "slr.updater.enabled", "false",
                "slr.retention.enabled", "false",
                "spring.main.web-application-type", "none");
    }
}
