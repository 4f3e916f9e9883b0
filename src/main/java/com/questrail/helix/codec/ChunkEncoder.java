package com.questrail.helix.codec;

import com.questrail.helix.internal.chunk.Chunk;

/**
 * ChunkEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for a single chunk.
 *
 * <p>This interface defines the outbound boundary between a structured
 * {@link Chunk} and the protected byte block that is mapped to symbols.</p>
 *
 * <p>The encoder applies, in order:</p>
 * <ul>
 *   <li>Header serialization</li>
 *   <li>Reed-Solomon parity append, at the level named in the header</li>
 * </ul>
 *
 * <p>It does not decide chunk boundaries, encrypt, or map to symbols.</p>
 */
public interface ChunkEncoder
{
    /**
     * Produces {@code header ‖ data ‖ parity} for {@code chunk}.
     */
    byte[] protect(Chunk chunk);
}
