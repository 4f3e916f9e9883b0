package com.questrail.helix.internal.chunk;

import java.util.Objects;

/**
 * A chunk recovered from a sequence: error-corrected, header-validated and
 * checksum-verified.
 *
 * <p>Instances are only produced by the chunk decoder after every per-chunk
 * check has passed. The reassembler performs the cross-chunk checks.</p>
 */
public final class DecodedChunk
{
    private final Chunk chunk;
    private final int sequencePosition;
    private final int correctedBytes;

    public DecodedChunk(Chunk chunk, int sequencePosition, int correctedBytes) {
        this.chunk = Objects.requireNonNull(chunk, "chunk");
        if (correctedBytes < 0) {
            throw new IllegalArgumentException("correctedBytes must be non-negative");
        }
        this.sequencePosition = sequencePosition;
        this.correctedBytes = correctedBytes;
    }

    public Chunk chunk() {
        return chunk;
    }

    public ChunkHeader header() {
        return chunk.header();
    }

    /**
     * Position of the source sequence in the caller's input collection.
     */
    public int sequencePosition() {
        return sequencePosition;
    }

    /**
     * Number of bytes the Reed-Solomon decoder repaired in this chunk.
     */
    public int correctedBytes() {
        return correctedBytes;
    }

    @Override
    public String toString() {
        return "DecodedChunk[" +
                "sequence=" + sequencePosition +
                ", " + chunk +
                ", correctedBytes=" + correctedBytes +
                ']';
    }
}
