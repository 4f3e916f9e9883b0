package com.questrail.helix.codec.impl;

import com.questrail.helix.codec.ChunkEncoder;
import com.questrail.helix.internal.chunk.Chunk;

import java.util.Objects;

/**
 * DefaultChunkEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ChunkEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultChunkDecoder}. It assumes
 * the caller has already produced a correctly sized {@link Chunk} with a
 * checksum that matches its data.</p>
 */
public final class DefaultChunkEncoder implements ChunkEncoder
{
    @Override
    public byte[] protect(Chunk chunk)
    {
        Objects.requireNonNull(chunk, "chunk");

        // ---------------------------------------------------------------------
        // 1) Canonical message: [ header ][ data... ]
        // ---------------------------------------------------------------------

        final byte[] header = HeaderCodec.encodeHeader(chunk.header());
        final byte[] data = chunk.data();

        final byte[] message = new byte[header.length + data.length];
        System.arraycopy(header, 0, message, 0, header.length);
        System.arraycopy(data, 0, message, header.length, data.length);

        // ---------------------------------------------------------------------
        // 2) Append parity: [ header ][ data... ][ parity... ]
        // ---------------------------------------------------------------------

        return ReedSolomonCoder.protect(message, chunk.header().correctionLevel());
    }
}
