package com.questrail.helix.internal.chunk;

import com.questrail.helix.codec.impl.ChunkChecksum;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Chunker
 * -----------------------------------------------------------------------------
 * Splits a byte stream into header-bearing chunks according to a
 * {@link ChunkLayout}.
 *
 * <p>All chunks except the last carry exactly {@code chunkSize} bytes. The last
 * carries the remainder and is never padded; the header's stream length tells
 * the reassembler exactly how many bytes to keep.</p>
 */
public final class Chunker
{
    private Chunker() {}

    /**
     * Splits {@code stream} into chunks.
     *
     * @param stream    bytes to split (payload or encryption envelope)
     * @param layout    solved layout for the call
     * @param encrypted whether {@code stream} is an encryption envelope
     * @return chunks in index order; at least one
     */
    public static List<Chunk> split(byte[] stream, ChunkLayout layout, boolean encrypted)
    {
        Objects.requireNonNull(stream, "stream");
        Objects.requireNonNull(layout, "layout");

        final int chunkSize = layout.chunkSize();
        final int total = layout.chunkCount(stream.length);
        final List<Chunk> chunks = new ArrayList<>(total);

        for (int index = 0; index < total; index++) {
            final int from = index * chunkSize;
            final int to = Math.min(stream.length, from + chunkSize);
            final byte[] data = Arrays.copyOfRange(stream, from, to);

            final ChunkHeader header = new ChunkHeader(
                    ChunkHeader.CURRENT_VERSION,
                    index,
                    total,
                    stream.length,
                    layout.correctionLevel(),
                    encrypted,
                    ChunkChecksum.compute(data));

            chunks.add(new Chunk(header, data));
        }
        return chunks;
    }
}
