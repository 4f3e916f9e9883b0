package com.questrail.helix.internal.chunk;

import com.questrail.helix.api.CorrectionLevel;
import com.questrail.helix.codec.impl.HeaderCodec;
import com.questrail.helix.codec.impl.ReedSolomonCoder;
import com.questrail.helix.codec.impl.SymbolCodec;
import com.questrail.helix.error.ConfigurationException;

import java.util.Objects;

/**
 * ChunkLayout
 * -----------------------------------------------------------------------------
 * Solves the per-chunk payload capacity for a requested sequence length.
 *
 * <p>A full chunk is laid out as</p>
 * <pre>
 *   [ header (19) ][ data (chunkSize) ][ parity (level) ]  → protectedLength bytes
 *   protectedLength × 4 symbols                            → baseLength symbols
 * </pre>
 *
 * <p>Each protected chunk is a single Reed-Solomon codeword, so
 * {@code protectedLength} may not exceed 255.</p>
 *
 * @param baseLength      symbols per full sequence
 * @param correctionLevel redundancy level
 * @param protectedLength bytes per full protected chunk
 * @param chunkSize       payload bytes per full chunk
 */
public record ChunkLayout(
    int baseLength,
    CorrectionLevel correctionLevel,
    int protectedLength,
    int chunkSize
) {
    public ChunkLayout {
        Objects.requireNonNull(correctionLevel, "correctionLevel");
    }

    /**
     * Computes the layout for a base length and level.
     *
     * @throws ConfigurationException if the base length is not a positive
     *         multiple of four, exceeds one codeword, or leaves no room for
     *         payload bytes
     */
    public static ChunkLayout solve(int baseLength, CorrectionLevel level) {
        Objects.requireNonNull(level, "level");

        final int perByte = SymbolCodec.SYMBOLS_PER_BYTE;
        if (baseLength <= 0 || baseLength % perByte != 0) {
            throw new ConfigurationException(
                    "Base length " + baseLength + " must be a positive multiple of " + perByte);
        }

        final int protectedLength = baseLength / perByte;
        if (protectedLength > ReedSolomonCoder.MAX_CODEWORD_LENGTH) {
            throw new ConfigurationException(
                    "Base length " + baseLength + " exceeds the maximum of "
                            + maxBaseLength() + " symbols per sequence");
        }

        final int chunkSize = protectedLength - HeaderCodec.HEADER_LENGTH - level.paritySymbols();
        if (chunkSize < 1) {
            throw new ConfigurationException(
                    "Base length " + baseLength + " cannot hold a payload byte at level " + level
                            + "; minimum is " + minBaseLength(level));
        }

        return new ChunkLayout(baseLength, level, protectedLength, chunkSize);
    }

    /**
     * Smallest base length that carries one payload byte per chunk.
     */
    public static int minBaseLength(CorrectionLevel level) {
        return (HeaderCodec.HEADER_LENGTH + level.paritySymbols() + 1) * SymbolCodec.SYMBOLS_PER_BYTE;
    }

    /**
     * Largest base length that still fits one Reed-Solomon codeword.
     */
    public static int maxBaseLength() {
        return ReedSolomonCoder.MAX_CODEWORD_LENGTH * SymbolCodec.SYMBOLS_PER_BYTE;
    }

    /**
     * Number of chunks a stream of {@code streamLength} bytes splits into.
     * An empty stream still occupies one (empty) chunk.
     */
    public int chunkCount(int streamLength) {
        if (streamLength == 0) {
            return 1;
        }
        return (streamLength - 1) / chunkSize + 1;
    }
}
