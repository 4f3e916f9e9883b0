package com.questrail.helix.internal.chunk;

import java.util.Objects;

/**
 * Chunk
 * -----------------------------------------------------------------------------
 * One header-bearing fragment of the chunked stream, prior to error-correction
 * coding.
 *
 * <h2>Why {@code byte[]} is used for data</h2>
 * Chunk data is dense, ordered, byte-oriented input to the Reed-Solomon coder.
 * Immutability is enforced via defensive copying.
 */
public final class Chunk
{
    private final ChunkHeader header;

    /**
     * Data bytes (may be empty, never null). Never padded: the last chunk of a
     * stream is simply shorter.
     */
    private final byte[] data;

    public Chunk(ChunkHeader header, byte[] data) {
        this.header = Objects.requireNonNull(header, "header");
        this.data = (data == null) ? new byte[0] : data.clone();
    }

    public ChunkHeader header() {
        return header;
    }

    /**
     * Returns a copy of the data bytes.
     */
    public byte[] data() {
        return data.clone();
    }

    public int dataLength() {
        return data.length;
    }

    @Override
    public String toString() {
        return "Chunk[" +
                "index=" + header.chunkIndex() +
                "/" + header.totalChunks() +
                ", dataLength=" + data.length +
                ", level=" + header.correctionLevel() +
                ", encrypted=" + header.encrypted() +
                ']';
    }
}
