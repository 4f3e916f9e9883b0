package com.questrail.helix.api;

import java.util.Optional;

/**
 * CorrectionLevel
 * -----------------------------------------------------------------------------
 * Closed set of Reed-Solomon redundancy levels supported by the codec.
 *
 * <p>Each level fixes the number of parity bytes appended to every chunk and,
 * consequently, the number of erroneous bytes per chunk the decoder is
 * guaranteed to repair ({@code paritySymbols / 2}).</p>
 *
 * <p>The level is written into every chunk header as a one-byte code. The
 * decoder reads it back from there; a level supplied by a caller at decode
 * time is only a hint for which level to try first.</p>
 */
public enum CorrectionLevel
{
    /** 8 parity bytes per chunk, repairs up to 4 corrupted bytes. */
    BASIC(0x01, 8),

    /** 16 parity bytes per chunk, repairs up to 8 corrupted bytes. */
    ADVANCED(0x02, 16);

    private final int code;
    private final int paritySymbols;

    CorrectionLevel(int code, int paritySymbols)
    {
        this.code = code;
        this.paritySymbols = paritySymbols;
    }

    /**
     * Returns the header byte value identifying this level.
     */
    public int code()
    {
        return code;
    }

    /**
     * Returns the number of Reed-Solomon parity bytes appended per chunk.
     */
    public int paritySymbols()
    {
        return paritySymbols;
    }

    /**
     * Returns the maximum number of corrupted bytes per chunk that decoding is
     * guaranteed to repair.
     */
    public int correctionBound()
    {
        return paritySymbols / 2;
    }

    /**
     * Returns the other level. Used by the decoder when the advisory level
     * does not match what the chunk was protected with.
     */
    public CorrectionLevel alternate()
    {
        return this == BASIC ? ADVANCED : BASIC;
    }

    /**
     * Resolves a header level code.
     *
     * @return the level, or {@link Optional#empty()} for an unknown code
     */
    public static Optional<CorrectionLevel> fromCode(int code)
    {
        for (CorrectionLevel level : values()) {
            if (level.code == code) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
