package com.questrail.helix.observability;

import com.questrail.helix.constraints.ConstraintReport;

import java.time.Instant;

/**
 * Record carrying a non-compliant constraint report for one encoded sequence.
 */
public record ConstraintViolationEvent(
    Instant timestamp,
    ConstraintReport report
) {
}
