package com.questrail.helix.internal.chunk;

import com.questrail.helix.api.CorrectionLevel;
import com.questrail.helix.codec.impl.ChunkChecksum;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChunkerTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link Chunker}. At base length 200 and level BASIC each full
 * chunk carries 23 bytes.
 */
final class ChunkerTest
{
    private static final ChunkLayout LAYOUT = ChunkLayout.solve(200, CorrectionLevel.BASIC);

    private static byte[] stream(int length)
    {
        byte[] b = new byte[length];
        for (int i = 0; i < length; i++) {
            b[i] = (byte) (i * 31 + 7);
        }
        return b;
    }

    @Test
    void emptyStreamYieldsOneEmptyChunk()
    {
        List<Chunk> chunks = Chunker.split(new byte[0], LAYOUT, false);

        assertEquals(1, chunks.size());
        assertEquals(0, chunks.get(0).dataLength());
        assertEquals(1, chunks.get(0).header().totalChunks());
        assertEquals(0, chunks.get(0).header().streamLength());
    }

    @Test
    void exactMultipleHasNoShortChunk()
    {
        List<Chunk> chunks = Chunker.split(stream(46), LAYOUT, false);

        assertEquals(2, chunks.size());
        assertEquals(23, chunks.get(0).dataLength());
        assertEquals(23, chunks.get(1).dataLength());
    }

    @Test
    void lastChunkCarriesRemainderUnpadded()
    {
        List<Chunk> chunks = Chunker.split(stream(47), LAYOUT, false);

        assertEquals(3, chunks.size());
        assertEquals(1, chunks.get(2).dataLength());
    }

    @Test
    void headersDescribeTheStream()
    {
        List<Chunk> chunks = Chunker.split(stream(69), LAYOUT, true);

        for (int i = 0; i < chunks.size(); i++) {
            ChunkHeader h = chunks.get(i).header();
            assertEquals(i, h.chunkIndex());
            assertEquals(3, h.totalChunks());
            assertEquals(69, h.streamLength());
            assertEquals(CorrectionLevel.BASIC, h.correctionLevel());
            assertTrue(h.encrypted());
            assertEquals(ChunkChecksum.compute(chunks.get(i).data()), h.checksum());
        }
    }

    @Test
    void concatenationRestoresStream()
    {
        byte[] original = stream(100);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Chunk c : Chunker.split(original, LAYOUT, false)) {
            out.writeBytes(c.data());
        }
        assertArrayEquals(original, out.toByteArray());
    }
}
