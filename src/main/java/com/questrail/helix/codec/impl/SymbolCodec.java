package com.questrail.helix.codec.impl;

import com.questrail.helix.error.ValidationException;

import java.util.Arrays;
import java.util.Objects;

/**
 * SymbolCodec
 * -----------------------------------------------------------------------------
 * Fixed 2-bit-per-symbol bijection between bytes and the nucleotide alphabet.
 *
 * <pre>
 *   00 → A    01 → T    10 → C    11 → G
 * </pre>
 *
 * <p>Each byte becomes four symbols, most significant bit pair first. The
 * mapping is purely mechanical: no reordering, no padding, no constraint
 * shaping.</p>
 */
public final class SymbolCodec
{
    /** Symbols emitted per byte (8 bits / 2 bits per symbol). */
    public static final int SYMBOLS_PER_BYTE = 4;

    /** Indexed by 2-bit value. */
    static final char[] ALPHABET = { 'A', 'T', 'C', 'G' };

    /** Reverse table indexed by upper-case ASCII; -1 marks characters outside the alphabet. */
    private static final int[] VALUES = new int[128];

    static {
        Arrays.fill(VALUES, -1);
        for (int v = 0; v < ALPHABET.length; v++) {
            VALUES[ALPHABET[v]] = v;
        }
    }

    private SymbolCodec() {}

    /**
     * Maps bytes to symbols.
     *
     * @return a string of exactly {@code 4 * bytes.length} characters from {@code ATCG}
     */
    public static String bytesToSymbols(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");

        final char[] out = new char[bytes.length * SYMBOLS_PER_BYTE];
        int w = 0;
        for (byte b : bytes) {
            final int v = b & 0xFF;
            out[w++] = ALPHABET[(v >>> 6) & 0b11];
            out[w++] = ALPHABET[(v >>> 4) & 0b11];
            out[w++] = ALPHABET[(v >>> 2) & 0b11];
            out[w++] = ALPHABET[v & 0b11];
        }
        return new String(out);
    }

    /**
     * Maps symbols back to bytes. Lower-case input is accepted.
     *
     * @throws ValidationException if the length is not a multiple of four or a
     *         character lies outside the alphabet
     */
    public static byte[] symbolsToBytes(CharSequence symbols)
    {
        Objects.requireNonNull(symbols, "symbols");

        final int length = symbols.length();
        if (length % SYMBOLS_PER_BYTE != 0) {
            throw new ValidationException(
                    "Sequence length " + length + " is not a multiple of " + SYMBOLS_PER_BYTE);
        }

        final byte[] out = new byte[length / SYMBOLS_PER_BYTE];
        for (int i = 0; i < out.length; i++) {
            int v = 0;
            for (int k = 0; k < SYMBOLS_PER_BYTE; k++) {
                final int offset = i * SYMBOLS_PER_BYTE + k;
                v = (v << 2) | valueOf(symbols.charAt(offset), offset);
            }
            out[i] = (byte) v;
        }
        return out;
    }

    private static int valueOf(char c, int offset)
    {
        final char upper = Character.toUpperCase(c);
        final int v = upper < VALUES.length ? VALUES[upper] : -1;
        if (v < 0) {
            throw new ValidationException(
                    "Invalid symbol '" + c + "' at offset " + offset + "; expected one of A, T, C, G");
        }
        return v;
    }
}
