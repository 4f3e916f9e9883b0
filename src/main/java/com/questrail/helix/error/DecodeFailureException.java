package com.questrail.helix.error;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Consolidated report of every sequence that failed per-chunk validation in a
 * single decode call.
 *
 * <p>Per-chunk checks are not short-circuited: all sequences are examined and
 * every failure is listed here, ordered by sequence position, so a caller can
 * judge whether re-requesting a few sequences is worthwhile.</p>
 *
 * <p>{@link #kind()} reports the kind of the first failure. Use
 * {@link #failures()} for the full picture.</p>
 */
public final class DecodeFailureException extends DnaCodecException
{
    private final List<ChunkFailure> failures;

    public DecodeFailureException(List<ChunkFailure> failures) {
        this(sorted(failures));
    }

    private DecodeFailureException(SortedFailures sorted) {
        super(sorted.failures.get(0).kind(), describe(sorted.failures), sorted.failures.get(0).cause());
        this.failures = sorted.failures;
        for (int i = 1; i < failures.size(); i++) {
            addSuppressed(failures.get(i).cause());
        }
    }

    public List<ChunkFailure> failures() {
        return failures;
    }

    /**
     * Returns true if any failure in the report is of the given kind.
     */
    public boolean hasFailureOfKind(ErrorKind kind) {
        return failures.stream().anyMatch(f -> f.kind() == kind);
    }

    private static String describe(List<ChunkFailure> failures) {
        StringBuilder sb = new StringBuilder()
                .append(failures.size())
                .append(failures.size() == 1 ? " sequence" : " sequences")
                .append(" failed validation:");
        for (ChunkFailure f : failures) {
            sb.append("\n  ").append(f);
        }
        return sb.toString();
    }

    private static SortedFailures sorted(List<ChunkFailure> failures) {
        Objects.requireNonNull(failures, "failures");
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("failures must not be empty");
        }
        return new SortedFailures(failures.stream()
                .sorted(Comparator.comparingInt(ChunkFailure::sequencePosition))
                .toList());
    }

    private record SortedFailures(List<ChunkFailure> failures) {}
}
