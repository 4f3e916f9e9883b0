package com.questrail.helix.codec.impl;

import com.questrail.helix.api.CorrectionLevel;
import com.questrail.helix.codec.ChunkDecoder;
import com.questrail.helix.error.ChecksumMismatchException;
import com.questrail.helix.error.DnaCodecException;
import com.questrail.helix.error.UncorrectableChunkException;
import com.questrail.helix.error.ValidationException;
import com.questrail.helix.internal.chunk.Chunk;
import com.questrail.helix.internal.chunk.ChunkHeader;
import com.questrail.helix.internal.chunk.DecodedChunk;

import java.util.Arrays;
import java.util.Objects;

/**
 * DefaultChunkDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ChunkDecoder}.
 *
 * <p>For each correction level, starting with the preferred one, the decoder
 * performs the following steps, in order:</p>
 * <ol>
 *   <li>Length check against the level's parity size</li>
 *   <li>Reed-Solomon recovery</li>
 *   <li>Header parsing</li>
 *   <li>Level confirmation: the header must name the level just used</li>
 *   <li>CRC-32 check of the data bytes</li>
 * </ol>
 *
 * <p><strong>Level selection.</strong> The level a chunk was protected with is
 * recorded only inside the codeword, so it cannot be read before correction.
 * The decoder therefore tries the preferred level and, unless that attempt
 * yields a header confirming it, the other one. Because a 16-parity codeword
 * is also a valid 8-parity codeword, a clean advanced chunk decoded as basic
 * surfaces its true level in the header and is retried accordingly.</p>
 *
 * <p>If both attempts fail, the failure from the attempt that got furthest
 * through the steps above is reported; ties go to the preferred level. A level
 * mismatch, or an invalid header produced by repairs, counts as a correction
 * failure: both are reported as {@link UncorrectableChunkException}. Only a
 * header that was invalid before any repair is a {@link ValidationException}.</p>
 */
public final class DefaultChunkDecoder implements ChunkDecoder
{
    private static final int STAGE_CORRECTION = 0;
    private static final int STAGE_HEADER = 1;
    private static final int STAGE_CHECKSUM = 2;

    @Override
    public DecodedChunk decode(byte[] protectedBlock, int sequencePosition, CorrectionLevel preferredLevel)
    {
        Objects.requireNonNull(protectedBlock, "protectedBlock");
        Objects.requireNonNull(preferredLevel, "preferredLevel");

        final Attempt preferred = attempt(protectedBlock, sequencePosition, preferredLevel);
        if (preferred.decoded != null) {
            return preferred.decoded;
        }

        final Attempt alternate = attempt(protectedBlock, sequencePosition, preferredLevel.alternate());
        if (alternate.decoded != null) {
            return alternate.decoded;
        }

        throw (alternate.stage > preferred.stage) ? alternate.failure : preferred.failure;
    }

    private static Attempt attempt(byte[] block, int position, CorrectionLevel level)
    {
        final int nsym = level.paritySymbols();
        if (block.length < HeaderCodec.HEADER_LENGTH + nsym || block.length > ReedSolomonCoder.MAX_CODEWORD_LENGTH) {
            return Attempt.failed(STAGE_CORRECTION, new ValidationException(String.format(
                    "Sequence #%d: %d-byte block cannot be a %s chunk (expected %d..%d bytes)",
                    position, block.length, level,
                    HeaderCodec.HEADER_LENGTH + nsym, ReedSolomonCoder.MAX_CODEWORD_LENGTH)));
        }

        // 1) Reed-Solomon recovery
        final ReedSolomonCoder.Recovery recovery;
        try {
            recovery = ReedSolomonCoder.recover(block, level);
        }
        catch (CorrectionFailedException e) {
            return Attempt.failed(STAGE_CORRECTION, new UncorrectableChunkException(
                    position, HeaderCodec.peekChunkIndex(block), level + " parity: " + e.getMessage()));
        }

        // 2) Header. An invalid header in a codeword that arrived clean was
        //    written that way; after repairs it means the code miscorrected.
        final byte[] message = recovery.message();
        final ChunkHeader header;
        try {
            header = HeaderCodec.decodeHeader(message);
        }
        catch (ValidationException e) {
            if (recovery.correctedCount() > 0) {
                return Attempt.failed(STAGE_CORRECTION, new UncorrectableChunkException(
                        position, HeaderCodec.peekChunkIndex(block),
                        level + " parity repaired " + recovery.correctedCount()
                                + " byte(s) into an invalid header: " + e.getMessage()));
            }
            return Attempt.failed(STAGE_HEADER, new ValidationException(
                    "Sequence #" + position + ": " + e.getMessage(), e));
        }

        // 3) Level confirmation. A mismatch means the correction ran against
        //    the wrong code, so it ranks no further than a failed correction.
        if (header.correctionLevel() != level) {
            return Attempt.failed(STAGE_CORRECTION, new UncorrectableChunkException(
                    position, HeaderCodec.peekChunkIndex(block),
                    level + " parity yields a header declaring " + header.correctionLevel()));
        }

        // 4) Checksum
        final byte[] data = Arrays.copyOfRange(message, HeaderCodec.HEADER_LENGTH, message.length);
        final long actual = ChunkChecksum.compute(data);
        if (actual != header.checksum()) {
            return Attempt.failed(STAGE_CHECKSUM,
                    new ChecksumMismatchException(header.chunkIndex(), header.checksum(), actual));
        }

        return Attempt.succeeded(new DecodedChunk(new Chunk(header, data), position, recovery.correctedCount()));
    }

    private static final class Attempt
    {
        final DecodedChunk decoded;
        final DnaCodecException failure;
        final int stage;

        private Attempt(DecodedChunk decoded, DnaCodecException failure, int stage)
        {
            this.decoded = decoded;
            this.failure = failure;
            this.stage = stage;
        }

        static Attempt succeeded(DecodedChunk decoded)
        {
            return new Attempt(decoded, null, Integer.MAX_VALUE);
        }

        static Attempt failed(int stage, DnaCodecException failure)
        {
            return new Attempt(null, failure, stage);
        }
    }
}
