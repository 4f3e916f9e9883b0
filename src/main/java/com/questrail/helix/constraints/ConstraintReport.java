package com.questrail.helix.constraints;

import java.util.List;
import java.util.Objects;

/**
 * Constraint findings for one sequence.
 *
 * @param sequenceIndex      position of the sequence in the encode result
 * @param gcContent          fraction of G and C symbols (0 for an empty sequence)
 * @param longestHomopolymer longest run of one repeated symbol
 * @param violations         every violation found, in sequence order
 */
public record ConstraintReport(
    int sequenceIndex,
    double gcContent,
    int longestHomopolymer,
    List<ConstraintViolation> violations
) {
    public ConstraintReport {
        violations = List.copyOf(Objects.requireNonNull(violations, "violations"));
    }

    public boolean compliant() {
        return violations.isEmpty();
    }
}
