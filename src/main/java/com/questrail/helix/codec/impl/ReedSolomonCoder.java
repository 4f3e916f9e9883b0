package com.questrail.helix.codec.impl;

import com.questrail.helix.api.CorrectionLevel;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * ReedSolomonCoder
 * =============================================================================
 * Systematic Reed-Solomon error-correcting code over {@link GaloisField GF(256)}.
 *
 * <h2>Code parameters</h2>
 * <ul>
 *   <li>Symbols are bytes; a codeword holds at most 255 of them</li>
 *   <li>Generator polynomial g(x) = (x - α^0)(x - α^1)...(x - α^(nsym-1)),
 *       with {@code nsym} = {@link CorrectionLevel#paritySymbols()}</li>
 *   <li>Codeword layout: {@code message ‖ parity}, highest-degree coefficient first</li>
 * </ul>
 *
 * <h2>Decoding</h2>
 * <ol>
 *   <li>Syndromes S_i = c(α^i); all zero means the codeword is clean</li>
 *   <li>Berlekamp-Massey yields the error locator Λ(x)</li>
 *   <li>Chien search finds the error positions (roots of Λ)</li>
 *   <li>Forney's algorithm computes the error magnitudes</li>
 *   <li>Syndromes are recomputed on the repaired codeword and must be zero</li>
 * </ol>
 * Up to {@code nsym / 2} corrupted bytes are always repaired. Beyond that the
 * decoder normally detects the failure (locator degree too high, root count
 * mismatch, residual syndrome) and throws {@link CorrectionFailedException};
 * the chunk checksum catches the rare miscorrection that slips through.
 */
public final class ReedSolomonCoder
{
    /** Upper bound on codeword length in GF(256). */
    public static final int MAX_CODEWORD_LENGTH = GaloisField.ORDER;

    private static final Map<CorrectionLevel, int[]> GENERATORS = new EnumMap<>(CorrectionLevel.class);

    static {
        for (CorrectionLevel level : CorrectionLevel.values()) {
            GENERATORS.put(level, generator(level.paritySymbols()));
        }
    }

    private ReedSolomonCoder() {}

    /**
     * Appends parity to {@code message}.
     *
     * @return {@code message ‖ parity}, {@code message.length + level.paritySymbols()} bytes
     * @throws IllegalArgumentException if the codeword would exceed 255 bytes
     */
    public static byte[] protect(byte[] message, CorrectionLevel level)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(level, "level");

        final int nsym = level.paritySymbols();
        if (message.length + nsym > MAX_CODEWORD_LENGTH) {
            throw new IllegalArgumentException(
                    "Codeword of " + (message.length + nsym) + " bytes exceeds " + MAX_CODEWORD_LENGTH);
        }

        final int[] gen = GENERATORS.get(level);

        // Synthetic division of message(x)·x^nsym by the monic g(x); the
        // remainder lands in the trailing nsym slots.
        final int[] buf = new int[message.length + nsym];
        for (int i = 0; i < message.length; i++) {
            buf[i] = message[i] & 0xFF;
        }
        for (int i = 0; i < message.length; i++) {
            final int coef = buf[i];
            if (coef != 0) {
                for (int j = 1; j < gen.length; j++) {
                    buf[i + j] ^= GaloisField.mul(gen[j], coef);
                }
            }
        }

        final byte[] out = Arrays.copyOf(message, message.length + nsym);
        for (int i = message.length; i < out.length; i++) {
            out[i] = (byte) buf[i];
        }
        return out;
    }

    /**
     * Locates and repairs corrupted bytes in {@code codeword}.
     *
     * @return the message region (parity removed) and the number of bytes repaired
     * @throws CorrectionFailedException if the corruption exceeds what the
     *         level's parity can repair
     * @throws IllegalArgumentException if the codeword length is impossible for the level
     */
    public static Recovery recover(byte[] codeword, CorrectionLevel level)
            throws CorrectionFailedException
    {
        Objects.requireNonNull(codeword, "codeword");
        Objects.requireNonNull(level, "level");

        final int nsym = level.paritySymbols();
        final int n = codeword.length;
        if (n <= nsym || n > MAX_CODEWORD_LENGTH) {
            throw new IllegalArgumentException(
                    "Codeword length " + n + " invalid for " + nsym + " parity bytes");
        }

        final int[] cw = new int[n];
        for (int i = 0; i < n; i++) {
            cw[i] = codeword[i] & 0xFF;
        }

        final int[] syndromes = syndromes(cw, nsym);
        if (allZero(syndromes)) {
            return new Recovery(Arrays.copyOf(codeword, n - nsym), 0);
        }

        // 1) Error locator
        final int[] locator = berlekampMassey(syndromes);
        final int errors = degree(locator);
        if (errors > level.correctionBound()) {
            throw new CorrectionFailedException(
                    "Error locator degree " + errors + " exceeds correction bound " + level.correctionBound());
        }

        // 2) Error positions. Byte j is the coefficient of x^(n-1-j), so its
        //    locator value is X_j = α^(n-1-j) and Λ(X_j^-1) = 0 marks an error.
        final int[] positions = new int[errors];
        int found = 0;
        for (int j = 0; j < n; j++) {
            if (GaloisField.polyEvalAscending(locator, GaloisField.alphaPow(-(n - 1 - j))) == 0) {
                if (found == errors) {
                    found++;
                    break;
                }
                positions[found++] = j;
            }
        }
        if (found != errors) {
            throw new CorrectionFailedException(
                    "Located " + found + " error positions for a locator of degree " + errors);
        }

        // 3) Error magnitudes (Forney, first consecutive root α^0):
        //    e_j = X_j · Ω(X_j^-1) / Λ'(X_j^-1),  Ω(x) = S(x)·Λ(x) mod x^nsym
        final int[] evaluator = evaluator(syndromes, locator, nsym);
        final int[] derivative = formalDerivative(locator);

        for (int position : positions) {
            final int x = GaloisField.alphaPow(n - 1 - position);
            final int xInv = GaloisField.inverse(x);
            final int denominator = GaloisField.polyEvalAscending(derivative, xInv);
            if (denominator == 0) {
                throw new CorrectionFailedException("Repeated root in error locator at byte " + position);
            }
            final int numerator = GaloisField.polyEvalAscending(evaluator, xInv);
            cw[position] ^= GaloisField.mul(x, GaloisField.div(numerator, denominator));
        }

        // 4) The repaired word must be a codeword.
        if (!allZero(syndromes(cw, nsym))) {
            throw new CorrectionFailedException("Residual syndrome after correcting " + errors + " bytes");
        }

        final byte[] message = new byte[n - nsym];
        for (int i = 0; i < message.length; i++) {
            message[i] = (byte) cw[i];
        }
        return new Recovery(message, errors);
    }

    private static int[] generator(int nsym)
    {
        int[] g = { 1 };
        for (int i = 0; i < nsym; i++) {
            g = GaloisField.polyMul(g, new int[] { 1, GaloisField.alphaPow(i) });
        }
        return g;
    }

    private static int[] syndromes(int[] cw, int nsym)
    {
        final int[] s = new int[nsym];
        for (int i = 0; i < nsym; i++) {
            s[i] = GaloisField.polyEvalDescending(cw, GaloisField.alphaPow(i));
        }
        return s;
    }

    /**
     * Returns the error locator Λ(x), lowest degree first, Λ_0 = 1.
     */
    private static int[] berlekampMassey(int[] s)
    {
        final int nsym = s.length;
        int[] c = new int[nsym + 1];
        int[] b = new int[nsym + 1];
        c[0] = 1;
        b[0] = 1;

        int l = 0;
        int m = 1;
        int bDiscrepancy = 1;

        for (int n = 0; n < nsym; n++) {
            int d = s[n];
            for (int i = 1; i <= l; i++) {
                d ^= GaloisField.mul(c[i], s[n - i]);
            }

            if (d == 0) {
                m++;
                continue;
            }

            final int coef = GaloisField.div(d, bDiscrepancy);
            if (2 * l <= n) {
                final int[] previous = c.clone();
                for (int i = 0; i + m <= nsym; i++) {
                    c[i + m] ^= GaloisField.mul(coef, b[i]);
                }
                l = n + 1 - l;
                b = previous;
                bDiscrepancy = d;
                m = 1;
            } else {
                for (int i = 0; i + m <= nsym; i++) {
                    c[i + m] ^= GaloisField.mul(coef, b[i]);
                }
                m++;
            }
        }
        return Arrays.copyOf(c, Math.max(l, degree(c)) + 1);
    }

    private static int[] evaluator(int[] s, int[] locator, int nsym)
    {
        final int[] omega = new int[nsym];
        for (int i = 0; i < nsym; i++) {
            for (int k = 0; k <= i && k < locator.length; k++) {
                omega[i] ^= GaloisField.mul(s[i - k], locator[k]);
            }
        }
        return omega;
    }

    /**
     * Formal derivative in characteristic 2: only odd-power terms survive.
     */
    private static int[] formalDerivative(int[] poly)
    {
        if (poly.length <= 1) {
            return new int[] { 0 };
        }
        final int[] d = new int[poly.length - 1];
        for (int i = 1; i < poly.length; i += 2) {
            d[i - 1] = poly[i];
        }
        return d;
    }

    private static int degree(int[] ascending)
    {
        for (int i = ascending.length - 1; i > 0; i--) {
            if (ascending[i] != 0) {
                return i;
            }
        }
        return 0;
    }

    private static boolean allZero(int[] values)
    {
        for (int v : values) {
            if (v != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Outcome of a successful {@link #recover(byte[], CorrectionLevel)}.
     */
    public static final class Recovery
    {
        private final byte[] message;
        private final int correctedCount;

        Recovery(byte[] message, int correctedCount)
        {
            this.message = message;
            this.correctedCount = correctedCount;
        }

        /**
         * Returns a copy of the repaired message region (parity removed).
         */
        public byte[] message()
        {
            return message.clone();
        }

        /**
         * Number of bytes repaired.
         */
        public int correctedCount()
        {
            return correctedCount;
        }
    }
}
