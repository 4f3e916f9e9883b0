package com.questrail.helix.error;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One entry of a {@link DecodeFailureException} report.
 *
 * @param sequencePosition position of the failing sequence in the caller's input
 * @param chunkIndex       chunk index if known ({@code -1} otherwise)
 * @param cause            the per-chunk failure
 */
public record ChunkFailure(
    int sequencePosition,
    int chunkIndex,
    DnaCodecException cause
) {
    public ChunkFailure {
        Objects.requireNonNull(cause, "cause");
    }

    public ErrorKind kind() {
        return cause.kind();
    }

    public OptionalInt knownChunkIndex() {
        return chunkIndex < 0 ? OptionalInt.empty() : OptionalInt.of(chunkIndex);
    }

    @Override
    public String toString() {
        return "ChunkFailure[" +
                "sequence=" + sequencePosition +
                ", chunk=" + (chunkIndex < 0 ? "?" : String.valueOf(chunkIndex)) +
                ", kind=" + kind() +
                ", message=" + cause.getMessage() +
                ']';
    }
}
