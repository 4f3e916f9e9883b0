package com.questrail.helix.constraints;

/**
 * Synthesis constraints encoded sequences are checked against.
 *
 * <p>Checking is report-only. The codec never alters a sequence to satisfy
 * these limits, since any substitution would break the bijection with the
 * protected bytes.</p>
 *
 * @param targetGcContent   desired fraction of G and C symbols
 * @param gcTolerance       allowed absolute deviation from the target
 * @param maxHomopolymerRun longest allowed run of one repeated symbol
 */
public record ConstraintPolicy(
    double targetGcContent,
    double gcTolerance,
    int maxHomopolymerRun
) {
    public ConstraintPolicy {
        if (targetGcContent < 0.0 || targetGcContent > 1.0) {
            throw new IllegalArgumentException("targetGcContent must be within 0..1");
        }
        if (gcTolerance < 0.0) {
            throw new IllegalArgumentException("gcTolerance must be non-negative");
        }
        if (maxHomopolymerRun < 1) {
            throw new IllegalArgumentException("maxHomopolymerRun must be at least 1");
        }
    }

    /**
     * GC content 0.5 ± 0.1, homopolymer runs of at most 3.
     */
    public static ConstraintPolicy defaults() {
        return new ConstraintPolicy(0.5, 0.1, 3);
    }

    public double minGcContent() {
        return targetGcContent - gcTolerance;
    }

    public double maxGcContent() {
        return targetGcContent + gcTolerance;
    }
}
