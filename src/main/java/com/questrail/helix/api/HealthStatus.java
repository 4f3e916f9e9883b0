package com.questrail.helix.api;

import java.util.Objects;

/**
 * Result of the codec's no-op liveness probe.
 *
 * @param status        always {@code "healthy"} when the codec is constructed
 * @param formatVersion chunk header format version this codec writes
 */
public record HealthStatus(String status, int formatVersion) {

    public static final String HEALTHY = "healthy";

    public HealthStatus {
        Objects.requireNonNull(status, "status");
    }

    public boolean healthy() {
        return HEALTHY.equals(status);
    }
}
