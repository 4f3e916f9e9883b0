package com.questrail.helix.internal.chunk;

import com.questrail.helix.api.CorrectionLevel;
import com.questrail.helix.error.ConfigurationException;
import com.questrail.helix.error.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ChunkLayoutTest
{
    @Test
    void defaultBaseLengthAtBasic()
    {
        ChunkLayout layout = ChunkLayout.solve(200, CorrectionLevel.BASIC);

        assertEquals(50, layout.protectedLength());
        assertEquals(50 - 19 - 8, layout.chunkSize());
    }

    @Test
    void defaultBaseLengthAtAdvanced()
    {
        ChunkLayout layout = ChunkLayout.solve(200, CorrectionLevel.ADVANCED);
        assertEquals(50 - 19 - 16, layout.chunkSize());
    }

    @Test
    void minimumBaseLengthCarriesOneByte()
    {
        assertEquals(112, ChunkLayout.minBaseLength(CorrectionLevel.BASIC));
        assertEquals(144, ChunkLayout.minBaseLength(CorrectionLevel.ADVANCED));
        assertEquals(1, ChunkLayout.solve(112, CorrectionLevel.BASIC).chunkSize());
        assertEquals(1, ChunkLayout.solve(144, CorrectionLevel.ADVANCED).chunkSize());
    }

    @Test
    void maximumBaseLengthFillsOneCodeword()
    {
        assertEquals(1020, ChunkLayout.maxBaseLength());
        assertEquals(255 - 19 - 16, ChunkLayout.solve(1020, CorrectionLevel.ADVANCED).chunkSize());
    }

    @Test
    void rejectsTooShort()
    {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ChunkLayout.solve(108, CorrectionLevel.BASIC));
        assertEquals(ErrorKind.CONFIGURATION, e.kind());
        assertTrue(e.getMessage().contains("112"));

        assertThrows(ConfigurationException.class, () -> ChunkLayout.solve(140, CorrectionLevel.ADVANCED));
    }

    @Test
    void rejectsNonMultipleOfFour()
    {
        assertThrows(ConfigurationException.class, () -> ChunkLayout.solve(201, CorrectionLevel.BASIC));
    }

    @Test
    void rejectsNonPositive()
    {
        assertThrows(ConfigurationException.class, () -> ChunkLayout.solve(0, CorrectionLevel.BASIC));
        assertThrows(ConfigurationException.class, () -> ChunkLayout.solve(-4, CorrectionLevel.BASIC));
    }

    @Test
    void rejectsBeyondOneCodeword()
    {
        assertThrows(ConfigurationException.class, () -> ChunkLayout.solve(1024, CorrectionLevel.BASIC));
    }

    @Test
    void chunkCount()
    {
        ChunkLayout layout = ChunkLayout.solve(200, CorrectionLevel.BASIC);

        assertEquals(1, layout.chunkCount(0));
        assertEquals(1, layout.chunkCount(1));
        assertEquals(1, layout.chunkCount(23));
        assertEquals(2, layout.chunkCount(24));
        assertEquals(2, layout.chunkCount(46));
        assertEquals(3, layout.chunkCount(47));
        assertEquals(10, layout.chunkCount(230));
    }
}
