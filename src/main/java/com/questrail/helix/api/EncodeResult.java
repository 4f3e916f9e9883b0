package com.questrail.helix.api;

import com.questrail.helix.constraints.ConstraintReport;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link DnaCodec#encode(byte[], EncodeOptions)}.
 *
 * @param sequences        encoded sequences in chunk index order
 * @param metadata         aggregate description of the call
 * @param constraintReports synthesis constraint findings, one per sequence, same order
 */
public record EncodeResult(
    List<String> sequences,
    EncodeMetadata metadata,
    List<ConstraintReport> constraintReports
) {
    public EncodeResult {
        sequences = List.copyOf(Objects.requireNonNull(sequences, "sequences"));
        Objects.requireNonNull(metadata, "metadata");
        constraintReports = List.copyOf(Objects.requireNonNull(constraintReports, "constraintReports"));
    }

    /**
     * Returns true if no sequence violates the configured constraint policy.
     */
    public boolean constraintCompliant() {
        return constraintReports.stream().allMatch(ConstraintReport::compliant);
    }
}
