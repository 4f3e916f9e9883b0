package com.questrail.helix.internal.chunk;

import com.questrail.helix.api.CorrectionLevel;

import java.util.Objects;

/**
 * ChunkHeader
 * -----------------------------------------------------------------------------
 * Immutable, decoded form of the fixed-width metadata block carried at the
 * front of every chunk.
 *
 * <p>{@code totalChunks}, {@code streamLength}, {@code correctionLevel} and
 * {@code encrypted} are replicated across every chunk of one encode call; the
 * reassembler uses that redundancy to detect sequences mixed from different
 * payloads.</p>
 *
 * <p>{@code streamLength} is the length of the byte stream that was chunked.
 * Without a password that is the payload; with one it is the encryption
 * envelope.</p>
 *
 * <p>The constructor rejects values the encoder can never legitimately
 * produce. Wire-level validation with decoder-specific errors happens in
 * {@code HeaderCodec} before this record is built.</p>
 *
 * @param version         header format version
 * @param chunkIndex      zero-based position of this chunk in the stream
 * @param totalChunks     number of chunks the stream was split into
 * @param streamLength    exact byte length of the chunked stream
 * @param correctionLevel redundancy level used to protect this chunk
 * @param encrypted       whether the stream is an encryption envelope
 * @param checksum        CRC-32 of this chunk's data bytes (unsigned 32-bit)
 */
public record ChunkHeader(
    int version,
    int chunkIndex,
    int totalChunks,
    int streamLength,
    CorrectionLevel correctionLevel,
    boolean encrypted,
    long checksum
) {
    /** Current and only supported header format. */
    public static final int CURRENT_VERSION = 1;

    public ChunkHeader {
        Objects.requireNonNull(correctionLevel, "correctionLevel");
        if (totalChunks < 1) {
            throw new IllegalArgumentException("totalChunks must be >= 1");
        }
        if (chunkIndex < 0 || chunkIndex >= totalChunks) {
            throw new IllegalArgumentException(
                    "chunkIndex " + chunkIndex + " outside 0.." + (totalChunks - 1));
        }
        if (streamLength < 0) {
            throw new IllegalArgumentException("streamLength must be non-negative");
        }
        if (checksum < 0 || checksum > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("checksum must be an unsigned 32-bit value");
        }
    }

    /**
     * Returns true if this chunk is the last one of its stream.
     */
    public boolean isLast() {
        return chunkIndex == totalChunks - 1;
    }

    /**
     * Returns true if {@code other} describes the same stream: same format,
     * count, length, level and encryption.
     */
    public boolean sameStreamAs(ChunkHeader other) {
        return version == other.version
                && totalChunks == other.totalChunks
                && streamLength == other.streamLength
                && correctionLevel == other.correctionLevel
                && encrypted == other.encrypted;
    }
}
