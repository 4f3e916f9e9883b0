package com.questrail.helix.codec.impl;

import com.questrail.helix.api.CorrectionLevel;
import com.questrail.helix.error.ValidationException;
import com.questrail.helix.internal.chunk.ChunkHeader;

import java.util.Objects;

/**
 * HeaderCodec
 * -----------------------------------------------------------------------------
 * Serializes and parses the fixed-width chunk header.
 *
 * <pre>
 *   offset  size  field
 *   ------  ----  -----------------------------------------------
 *        0     1  format version ($01)
 *        1     1  correction level code ($01 basic, $02 advanced)
 *        2     1  flags (bit 0: encrypted; bits 1-7 reserved, zero)
 *        3     4  chunk index, big-endian
 *        7     4  total chunk count, big-endian
 *       11     4  stream length in bytes, big-endian
 *       15     4  CRC-32 of the chunk data, big-endian
 * </pre>
 *
 * <p>The header is protected by the same Reed-Solomon codeword as the data it
 * describes, so by the time it is parsed it has already been error-corrected.
 * Parsing only checks structure.</p>
 */
public final class HeaderCodec
{
    public static final int HEADER_LENGTH = 19;

    static final int FLAG_ENCRYPTED = 0x01;
    static final int RESERVED_FLAGS = 0xFE;

    static final int OFFSET_VERSION = 0;
    static final int OFFSET_LEVEL = 1;
    static final int OFFSET_FLAGS = 2;
    static final int OFFSET_INDEX = 3;
    static final int OFFSET_TOTAL = 7;
    static final int OFFSET_LENGTH = 11;
    static final int OFFSET_CHECKSUM = 15;

    private HeaderCodec() {}

    /**
     * Serializes {@code header} into {@value #HEADER_LENGTH} bytes.
     */
    public static byte[] encodeHeader(ChunkHeader header)
    {
        Objects.requireNonNull(header, "header");

        final byte[] out = new byte[HEADER_LENGTH];
        out[OFFSET_VERSION] = (byte) header.version();
        out[OFFSET_LEVEL] = (byte) header.correctionLevel().code();
        out[OFFSET_FLAGS] = (byte) (header.encrypted() ? FLAG_ENCRYPTED : 0);
        putInt(out, OFFSET_INDEX, header.chunkIndex());
        putInt(out, OFFSET_TOTAL, header.totalChunks());
        putInt(out, OFFSET_LENGTH, header.streamLength());
        putInt(out, OFFSET_CHECKSUM, (int) header.checksum());
        return out;
    }

    /**
     * Parses the first {@value #HEADER_LENGTH} bytes of {@code bytes}.
     *
     * @throws ValidationException if the header is truncated, of an unknown
     *         version or level, has reserved flags set, or is internally
     *         inconsistent (index outside the count, or a count and length no
     *         encoder at that level could emit)
     */
    public static ChunkHeader decodeHeader(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length < HEADER_LENGTH) {
            throw new ValidationException(
                    "Header requires " + HEADER_LENGTH + " bytes, got " + bytes.length);
        }

        final int version = bytes[OFFSET_VERSION] & 0xFF;
        if (version != ChunkHeader.CURRENT_VERSION) {
            throw new ValidationException("Unsupported header version " + version);
        }

        final int levelCode = bytes[OFFSET_LEVEL] & 0xFF;
        final CorrectionLevel level = CorrectionLevel.fromCode(levelCode)
                .orElseThrow(() -> new ValidationException(
                        String.format("Unknown correction level code 0x%02X", levelCode)));

        final int flags = bytes[OFFSET_FLAGS] & 0xFF;
        if ((flags & RESERVED_FLAGS) != 0) {
            throw new ValidationException(String.format("Reserved header flags set: 0x%02X", flags));
        }

        final int index = readInt(bytes, OFFSET_INDEX);
        final int total = readInt(bytes, OFFSET_TOTAL);
        final int length = readInt(bytes, OFFSET_LENGTH);
        final long checksum = readInt(bytes, OFFSET_CHECKSUM) & 0xFFFF_FFFFL;

        if (total < 1) {
            throw new ValidationException("Total chunk count " + total + " must be at least 1");
        }
        if (index < 0 || index >= total) {
            throw new ValidationException(
                    "Chunk index " + index + " outside 0.." + (total - 1));
        }
        if (length < 0) {
            throw new ValidationException("Stream length " + length + " is negative");
        }

        // Count and length must describe a stream this level could have produced:
        // no chunk carries more than one codeword's worth of data, and every
        // chunk of a non-empty stream carries at least one byte.
        final long capacity = (long) total * maxDataLength(level);
        if (length > capacity) {
            throw new ValidationException(String.format(
                    "Stream length %d cannot fit in %d %s chunk(s) of at most %d bytes",
                    length, total, level, maxDataLength(level)));
        }
        if (total > Math.max(1, length)) {
            throw new ValidationException(String.format(
                    "Total chunk count %d exceeds what a %d-byte stream needs", total, length));
        }

        return new ChunkHeader(version, index, total, length, level, (flags & FLAG_ENCRYPTED) != 0, checksum);
    }

    /**
     * Largest number of data bytes one chunk at {@code level} can carry.
     */
    static int maxDataLength(CorrectionLevel level)
    {
        return ReedSolomonCoder.MAX_CODEWORD_LENGTH - HEADER_LENGTH - level.paritySymbols();
    }

    /**
     * Reads the chunk index field without validating anything else. Used only
     * to label chunks that could not be corrected.
     *
     * @return the raw index, or {@code -1} if too short or negative
     */
    static int peekChunkIndex(byte[] bytes)
    {
        if (bytes == null || bytes.length < OFFSET_INDEX + 4) {
            return -1;
        }
        final int index = readInt(bytes, OFFSET_INDEX);
        return Math.max(index, -1);
    }

    static void putInt(byte[] out, int offset, int value)
    {
        out[offset] = (byte) (value >>> 24);
        out[offset + 1] = (byte) (value >>> 16);
        out[offset + 2] = (byte) (value >>> 8);
        out[offset + 3] = (byte) value;
    }

    static int readInt(byte[] in, int offset)
    {
        return ((in[offset] & 0xFF) << 24)
                | ((in[offset + 1] & 0xFF) << 16)
                | ((in[offset + 2] & 0xFF) << 8)
                | (in[offset + 3] & 0xFF);
    }
}
