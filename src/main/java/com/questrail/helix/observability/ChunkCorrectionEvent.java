package com.questrail.helix.observability;

import com.questrail.helix.api.CorrectionLevel;

import java.time.Instant;

/**
 * Record describing bytes repaired in one chunk during decode.
 */
public record ChunkCorrectionEvent(
    Instant timestamp,
    int sequencePosition,
    int chunkIndex,
    int correctedBytes,
    CorrectionLevel correctionLevel
) {
    /**
     * Fraction of the level's correction bound used by this chunk.
     */
    public double boundUtilization() {
        return (double) correctedBytes / correctionLevel.correctionBound();
    }
}
