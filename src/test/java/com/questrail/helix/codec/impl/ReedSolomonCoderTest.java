package com.questrail.helix.codec.impl;

import com.questrail.helix.api.CorrectionLevel;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReedSolomonCoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link ReedSolomonCoder}.
 *
 * <p>Corruption is injected by XOR-ing a non-zero mask into distinct byte
 * positions, so every touched byte really changes.</p>
 */
final class ReedSolomonCoderTest
{
    private static byte[] message(int length, long seed)
    {
        byte[] m = new byte[length];
        new Random(seed).nextBytes(m);
        return m;
    }

    private static byte[] corrupt(byte[] codeword, int... positions)
    {
        byte[] copy = codeword.clone();
        for (int i = 0; i < positions.length; i++) {
            int mask = (0x5A + i * 17) & 0xFF;
            copy[positions[i]] ^= (byte) (mask == 0 ? 0x01 : mask);
        }
        return copy;
    }

    @Test
    void protectIsSystematic()
    {
        byte[] m = message(30, 1);
        byte[] cw = ReedSolomonCoder.protect(m, CorrectionLevel.BASIC);

        assertEquals(38, cw.length);
        assertArrayEquals(m, Arrays.copyOf(cw, m.length));
    }

    @Test
    void parityLengthFollowsLevel()
    {
        byte[] m = message(30, 2);
        assertEquals(30 + 8, ReedSolomonCoder.protect(m, CorrectionLevel.BASIC).length);
        assertEquals(30 + 16, ReedSolomonCoder.protect(m, CorrectionLevel.ADVANCED).length);
    }

    @Test
    void cleanCodewordRecoversWithoutCorrections() throws Exception
    {
        byte[] m = message(40, 3);
        ReedSolomonCoder.Recovery r = ReedSolomonCoder.recover(
                ReedSolomonCoder.protect(m, CorrectionLevel.ADVANCED), CorrectionLevel.ADVANCED);

        assertArrayEquals(m, r.message());
        assertEquals(0, r.correctedCount());
    }

    @Test
    void correctsSingleError() throws Exception
    {
        byte[] m = message(25, 4);
        byte[] cw = ReedSolomonCoder.protect(m, CorrectionLevel.BASIC);

        ReedSolomonCoder.Recovery r = ReedSolomonCoder.recover(corrupt(cw, 10), CorrectionLevel.BASIC);

        assertArrayEquals(m, r.message());
        assertEquals(1, r.correctedCount());
    }

    @Test
    void correctsUpToBasicBound() throws Exception
    {
        byte[] m = message(23 + 19, 5);
        byte[] cw = ReedSolomonCoder.protect(m, CorrectionLevel.BASIC);

        ReedSolomonCoder.Recovery r = ReedSolomonCoder.recover(
                corrupt(cw, 0, 13, 27, 41), CorrectionLevel.BASIC);

        assertArrayEquals(m, r.message());
        assertEquals(4, r.correctedCount());
    }

    @Test
    void correctsUpToAdvancedBound() throws Exception
    {
        byte[] m = message(15 + 19, 6);
        byte[] cw = ReedSolomonCoder.protect(m, CorrectionLevel.ADVANCED);

        ReedSolomonCoder.Recovery r = ReedSolomonCoder.recover(
                corrupt(cw, 1, 5, 9, 14, 20, 33, 40, 49), CorrectionLevel.ADVANCED);

        assertArrayEquals(m, r.message());
        assertEquals(8, r.correctedCount());
    }

    @Test
    void correctsErrorsInParity() throws Exception
    {
        byte[] m = message(20, 7);
        byte[] cw = ReedSolomonCoder.protect(m, CorrectionLevel.BASIC);

        ReedSolomonCoder.Recovery r = ReedSolomonCoder.recover(
                corrupt(cw, cw.length - 1, cw.length - 8), CorrectionLevel.BASIC);

        assertArrayEquals(m, r.message());
        assertEquals(2, r.correctedCount());
    }

    @Test
    void correctsAtMaximumCodewordLength() throws Exception
    {
        byte[] m = message(ReedSolomonCoder.MAX_CODEWORD_LENGTH - 16, 8);
        byte[] cw = ReedSolomonCoder.protect(m, CorrectionLevel.ADVANCED);
        assertEquals(ReedSolomonCoder.MAX_CODEWORD_LENGTH, cw.length);

        ReedSolomonCoder.Recovery r = ReedSolomonCoder.recover(
                corrupt(cw, 0, 100, 200, 254), CorrectionLevel.ADVANCED);

        assertArrayEquals(m, r.message());
    }

    @Test
    void randomCorruptionWithinBoundAlwaysRecovers() throws Exception
    {
        Random random = new Random(99);
        for (int trial = 0; trial < 50; trial++) {
            CorrectionLevel level = (trial % 2 == 0) ? CorrectionLevel.BASIC : CorrectionLevel.ADVANCED;
            byte[] m = message(20 + random.nextInt(60), trial);
            byte[] cw = ReedSolomonCoder.protect(m, level);

            int errors = 1 + random.nextInt(level.correctionBound());
            int[] positions = random.ints(0, cw.length).distinct().limit(errors).toArray();

            ReedSolomonCoder.Recovery r = ReedSolomonCoder.recover(corrupt(cw, positions), level);
            assertArrayEquals(m, r.message(), "trial " + trial);
            assertEquals(errors, r.correctedCount(), "trial " + trial);
        }
    }

    @Test
    void detectsCorruptionBeyondBound()
    {
        byte[] m = message(15 + 19, 10);
        byte[] cw = ReedSolomonCoder.protect(m, CorrectionLevel.ADVANCED);

        assertThrows(CorrectionFailedException.class, () -> ReedSolomonCoder.recover(
                corrupt(cw, 0, 3, 7, 11, 17, 22, 30, 38, 45), CorrectionLevel.ADVANCED));
    }

    @Test
    void protectRejectsOversizedCodeword()
    {
        byte[] m = new byte[ReedSolomonCoder.MAX_CODEWORD_LENGTH - 7];
        assertThrows(IllegalArgumentException.class, () -> ReedSolomonCoder.protect(m, CorrectionLevel.BASIC));
    }

    @Test
    void recoverRejectsCodewordNoLongerThanParity()
    {
        assertThrows(IllegalArgumentException.class,
                () -> ReedSolomonCoder.recover(new byte[8], CorrectionLevel.BASIC));
    }

    @Test
    void recoverReturnsCopy() throws Exception
    {
        byte[] m = message(10, 11);
        ReedSolomonCoder.Recovery r = ReedSolomonCoder.recover(
                ReedSolomonCoder.protect(m, CorrectionLevel.BASIC), CorrectionLevel.BASIC);

        byte[] first = r.message();
        first[0] ^= 0x01;
        assertArrayEquals(m, r.message());
    }
}
