package com.questrail.helix.codec.impl;

/**
 * GaloisField
 * -----------------------------------------------------------------------------
 * Arithmetic in GF(2^8) for the Reed-Solomon coder.
 *
 * <p>Field parameters:</p>
 * <ul>
 *   <li>Primitive polynomial: x^8 + x^4 + x^3 + x^2 + 1 ({@code 0x11D})</li>
 *   <li>Generator element: α = 2</li>
 * </ul>
 *
 * <p>Addition and subtraction are both XOR. Multiplication and division go
 * through log/antilog tables; the antilog table is doubled so a sum of two
 * logarithms indexes it without reduction.</p>
 */
final class GaloisField
{
    static final int PRIMITIVE_POLY = 0x11D;

    /** Number of non-zero field elements; also the multiplicative order of α. */
    static final int ORDER = 255;

    private static final int[] EXP = new int[ORDER * 2];
    private static final int[] LOG = new int[ORDER + 1];

    static {
        int x = 1;
        for (int i = 0; i < ORDER; i++) {
            EXP[i] = x;
            LOG[x] = i;
            x <<= 1;
            if ((x & 0x100) != 0) {
                x ^= PRIMITIVE_POLY;
            }
        }
        for (int i = ORDER; i < EXP.length; i++) {
            EXP[i] = EXP[i - ORDER];
        }
    }

    private GaloisField() {}

    static int add(int a, int b)
    {
        return a ^ b;
    }

    static int mul(int a, int b)
    {
        if (a == 0 || b == 0) {
            return 0;
        }
        return EXP[LOG[a] + LOG[b]];
    }

    static int div(int a, int b)
    {
        if (b == 0) {
            throw new ArithmeticException("Division by zero in GF(256)");
        }
        if (a == 0) {
            return 0;
        }
        return EXP[LOG[a] + ORDER - LOG[b]];
    }

    static int inverse(int a)
    {
        if (a == 0) {
            throw new ArithmeticException("Zero has no inverse in GF(256)");
        }
        return EXP[ORDER - LOG[a]];
    }

    /**
     * Returns α^power for any integer power, negative included.
     */
    static int alphaPow(int power)
    {
        int p = power % ORDER;
        if (p < 0) {
            p += ORDER;
        }
        return EXP[p];
    }

    /**
     * Multiplies two polynomials stored highest degree first.
     */
    static int[] polyMul(int[] p, int[] q)
    {
        final int[] r = new int[p.length + q.length - 1];
        for (int j = 0; j < q.length; j++) {
            for (int i = 0; i < p.length; i++) {
                r[i + j] ^= mul(p[i], q[j]);
            }
        }
        return r;
    }

    /**
     * Evaluates a polynomial stored highest degree first (Horner).
     */
    static int polyEvalDescending(int[] poly, int x)
    {
        int y = poly[0];
        for (int i = 1; i < poly.length; i++) {
            y = mul(y, x) ^ poly[i];
        }
        return y;
    }

    /**
     * Evaluates a polynomial stored lowest degree first (Horner from the top).
     */
    static int polyEvalAscending(int[] poly, int x)
    {
        int y = 0;
        for (int i = poly.length - 1; i >= 0; i--) {
            y = mul(y, x) ^ poly[i];
        }
        return y;
    }
}
