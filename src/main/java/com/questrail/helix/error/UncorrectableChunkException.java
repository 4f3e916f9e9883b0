package com.questrail.helix.error;

import java.util.OptionalInt;

/**
 * Indicates that a sequence carries more corrupted bytes than its
 * Reed-Solomon parity can repair.
 *
 * <p>Because the header itself could not be trusted, the chunk is identified by
 * the position of its sequence in the caller's input. Where the raw header
 * bytes were still readable, the chunk index they claim is attached as a hint;
 * it is unverified.</p>
 */
public final class UncorrectableChunkException extends DnaCodecException
{
    private final int sequencePosition;
    private final int claimedChunkIndex;

    public UncorrectableChunkException(int sequencePosition, int claimedChunkIndex, String reason) {
        super(ErrorKind.UNCORRECTABLE, describe(sequencePosition, claimedChunkIndex, reason));
        this.sequencePosition = sequencePosition;
        this.claimedChunkIndex = claimedChunkIndex;
    }

    public int sequencePosition() {
        return sequencePosition;
    }

    /**
     * Returns the chunk index read from the uncorrected header, if any.
     */
    public OptionalInt claimedChunkIndex() {
        return claimedChunkIndex < 0 ? OptionalInt.empty() : OptionalInt.of(claimedChunkIndex);
    }

    private static String describe(int sequencePosition, int claimedChunkIndex, String reason) {
        StringBuilder sb = new StringBuilder("Sequence #").append(sequencePosition);
        if (claimedChunkIndex >= 0) {
            sb.append(" (claims chunk index ").append(claimedChunkIndex).append(')');
        }
        return sb.append(" is uncorrectable: ").append(reason).toString();
    }
}
