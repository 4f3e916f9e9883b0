package com.questrail.helix.codec;

import com.questrail.helix.api.CorrectionLevel;
import com.questrail.helix.internal.chunk.DecodedChunk;

/**
 * ChunkDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for a single protected chunk.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Repairing corruption within the Reed-Solomon bound</li>
 *   <li>Parsing and structurally validating the header</li>
 *   <li>Verifying the data checksum</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Symbol-to-byte mapping</li>
 *   <li>Cross-chunk consistency, ordering or completeness</li>
 *   <li>Decryption</li>
 * </ul>
 *
 * <p>Unlike a transport decoder that may silently drop bad input, every
 * failure here is reported: the caller aggregates them into a per-call
 * report.</p>
 */
public interface ChunkDecoder
{
    /**
     * Decodes one protected block.
     *
     * @param protectedBlock   bytes recovered from one sequence
     * @param sequencePosition position of that sequence in the caller's input
     * @param preferredLevel   level to attempt first; the header has the final say
     * @return the validated chunk
     *
     * @throws com.questrail.helix.error.UncorrectableChunkException if corruption exceeds the bound
     * @throws com.questrail.helix.error.ValidationException if the block or header is malformed
     * @throws com.questrail.helix.error.ChecksumMismatchException if the data checksum fails
     */
    DecodedChunk decode(byte[] protectedBlock, int sequencePosition, CorrectionLevel preferredLevel);
}
