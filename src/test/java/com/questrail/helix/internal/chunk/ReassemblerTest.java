package com.questrail.helix.internal.chunk;

import com.questrail.helix.api.CorrectionLevel;
import com.questrail.helix.codec.impl.ChunkChecksum;
import com.questrail.helix.error.MissingChunkException;
import com.questrail.helix.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReassemblerTest
 * -----------------------------------------------------------------------------
 * Cross-chunk checks and ordered merge in {@link Reassembler}.
 */
final class ReassemblerTest
{
    private static final ChunkLayout LAYOUT = ChunkLayout.solve(200, CorrectionLevel.BASIC);

    private static byte[] stream(int length)
    {
        byte[] b = new byte[length];
        for (int i = 0; i < length; i++) {
            b[i] = (byte) (i ^ 0x5C);
        }
        return b;
    }

    private static List<DecodedChunk> decoded(byte[] stream, boolean encrypted)
    {
        List<DecodedChunk> out = new ArrayList<>();
        List<Chunk> chunks = Chunker.split(stream, LAYOUT, encrypted);
        for (int i = 0; i < chunks.size(); i++) {
            out.add(new DecodedChunk(chunks.get(i), i, 0));
        }
        return out;
    }

    @Test
    void reassemblesInIndexOrder()
    {
        byte[] original = stream(80);
        Reassembler.ReassembledStream result = Reassembler.reassemble(decoded(original, false));

        assertArrayEquals(original, result.bytes());
        assertFalse(result.encrypted());
    }

    @Test
    void inputOrderDoesNotMatter()
    {
        byte[] original = stream(80);
        List<DecodedChunk> chunks = decoded(original, true);
        Collections.reverse(chunks);

        Reassembler.ReassembledStream result = Reassembler.reassemble(chunks);
        assertArrayEquals(original, result.bytes());
        assertTrue(result.encrypted());
    }

    @Test
    void singleEmptyChunk()
    {
        assertArrayEquals(new byte[0], Reassembler.reassemble(decoded(new byte[0], false)).bytes());
    }

    @Test
    void duplicateIndexIsRejected()
    {
        List<DecodedChunk> chunks = decoded(stream(50), false);
        chunks.add(new DecodedChunk(chunks.get(1).chunk(), 9, 0));

        ValidationException e = assertThrows(ValidationException.class, () -> Reassembler.reassemble(chunks));
        assertTrue(e.getMessage().contains("[1]"));
    }

    @Test
    void duplicatesReportedBeforeMissing()
    {
        List<DecodedChunk> chunks = decoded(stream(50), false);
        chunks.set(2, new DecodedChunk(chunks.get(0).chunk(), 2, 0));

        assertThrows(ValidationException.class, () -> Reassembler.reassemble(chunks));
    }

    @Test
    void everyMissingIndexIsListed()
    {
        List<DecodedChunk> chunks = decoded(stream(120), false);
        chunks.remove(4);
        chunks.remove(1);

        MissingChunkException e = assertThrows(MissingChunkException.class, () -> Reassembler.reassemble(chunks));
        assertEquals(List.of(1, 4), e.missingIndices());
        assertEquals(6, e.totalChunks());
    }

    @Test
    void missingFirstAndLastAreListed()
    {
        List<DecodedChunk> chunks = decoded(stream(120), false);
        chunks.remove(5);
        chunks.remove(0);

        MissingChunkException e = assertThrows(MissingChunkException.class, () -> Reassembler.reassemble(chunks));
        assertEquals(List.of(0, 5), e.missingIndices());
    }

    @Test
    void forgedHugeCountReportsMissingWithoutMaterializing()
    {
        byte[] data = {0x2A};
        ChunkHeader forged = new ChunkHeader(ChunkHeader.CURRENT_VERSION, 3, Integer.MAX_VALUE, Integer.MAX_VALUE,
                CorrectionLevel.BASIC, false, ChunkChecksum.compute(data));

        MissingChunkException e = assertThrows(MissingChunkException.class,
                () -> Reassembler.reassemble(List.of(new DecodedChunk(new Chunk(forged, data), 0, 0))));

        assertEquals(Integer.MAX_VALUE, e.totalChunks());
        assertEquals(Integer.MAX_VALUE - 1, e.missingIndices().size());
        assertEquals(List.of(0, 1, 2, 4), e.missingIndices().subList(0, 4));
        assertEquals(Integer.MAX_VALUE - 1, e.missingIndices().get(e.missingIndices().size() - 1).intValue());
        assertTrue(e.getMessage().startsWith("Missing " + (Integer.MAX_VALUE - 1) + " chunk indices"));
    }

    @Test
    void forgedHugeLengthIsRejectedBeforeAllocation()
    {
        byte[] data = stream(5);
        ChunkHeader forged = new ChunkHeader(ChunkHeader.CURRENT_VERSION, 0, 1, Integer.MAX_VALUE,
                CorrectionLevel.BASIC, false, ChunkChecksum.compute(data));

        ValidationException e = assertThrows(ValidationException.class,
                () -> Reassembler.reassemble(List.of(new DecodedChunk(new Chunk(forged, data), 0, 0))));
        assertTrue(e.getMessage().contains("Reassembled 5 bytes"));
    }

    @Test
    void chunksFromDifferentStreamsAreRejected()
    {
        List<DecodedChunk> chunks = decoded(stream(50), false);
        List<DecodedChunk> other = decoded(stream(60), false);
        chunks.set(1, other.get(1));

        assertThrows(ValidationException.class, () -> Reassembler.reassemble(chunks));
    }

    @Test
    void encryptionFlagMustAgree()
    {
        List<DecodedChunk> chunks = decoded(stream(50), false);
        chunks.set(0, decoded(stream(50), true).get(0));

        assertThrows(ValidationException.class, () -> Reassembler.reassemble(chunks));
    }

    @Test
    void shortInteriorChunkIsRejected()
    {
        List<DecodedChunk> chunks = decoded(stream(50), false);
        byte[] shortData = new byte[10];
        ChunkHeader h = chunks.get(1).header();
        ChunkHeader forged = new ChunkHeader(h.version(), h.chunkIndex(), h.totalChunks(), h.streamLength(),
                h.correctionLevel(), h.encrypted(), ChunkChecksum.compute(shortData));
        chunks.set(1, new DecodedChunk(new Chunk(forged, shortData), 1, 0));

        assertThrows(ValidationException.class, () -> Reassembler.reassemble(chunks));
    }

    @Test
    void streamShorterThanDeclaredIsRejected()
    {
        List<DecodedChunk> chunks = decoded(stream(50), false);
        DecodedChunk last = chunks.get(2);
        ChunkHeader h = last.header();
        ChunkHeader forged = new ChunkHeader(h.version(), h.chunkIndex(), h.totalChunks(), h.streamLength(),
                h.correctionLevel(), h.encrypted(), ChunkChecksum.compute(new byte[0]));
        chunks.set(2, new DecodedChunk(new Chunk(forged, new byte[0]), 2, 0));

        assertThrows(ValidationException.class, () -> Reassembler.reassemble(chunks));
    }

    @Test
    void emptyInputIsRejected()
    {
        assertThrows(ValidationException.class, () -> Reassembler.reassemble(List.of()));
    }
}
