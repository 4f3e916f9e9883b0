package com.questrail.helix.internal.chunk;

import com.questrail.helix.error.MissingChunkException;
import com.questrail.helix.error.ValidationException;

import java.util.AbstractList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reassembler
 * =============================================================================
 * Merges individually validated chunks back into the original byte stream.
 *
 * <h2>What this class assumes</h2>
 * Every {@link DecodedChunk} passed in has already been error-corrected, had
 * its header parsed and its checksum verified. Only cross-chunk properties are
 * checked here.
 *
 * <h2>Checks, in order</h2>
 * <ol>
 *   <li>All headers describe the same stream (version, total count, stream
 *       length, level, encryption)</li>
 *   <li>No chunk index appears twice. Two copies of one index are rejected
 *       rather than arbitrated.</li>
 *   <li>Every index in {@code 0..total-1} is present</li>
 *   <li>All chunks before the last have equal data length</li>
 *   <li>The concatenation covers the declared stream length</li>
 * </ol>
 * The result is truncated to the declared stream length.
 */
public final class Reassembler
{
    private Reassembler() {}

    /**
     * Reassembles a stream from validated chunks supplied in any order.
     *
     * @throws ValidationException    on disagreement, duplicates or a short stream
     * @throws MissingChunkException  if any index is absent
     */
    public static ReassembledStream reassemble(List<DecodedChunk> chunks)
    {
        Objects.requireNonNull(chunks, "chunks");
        if (chunks.isEmpty()) {
            throw new ValidationException("No chunks to reassemble");
        }

        final ChunkHeader reference = chunks.get(0).header();
        for (DecodedChunk chunk : chunks) {
            if (!reference.sameStreamAs(chunk.header())) {
                throw new ValidationException(String.format(
                        "Sequence #%d disagrees with sequence #%d: %s vs %s",
                        chunk.sequencePosition(),
                        chunks.get(0).sequencePosition(),
                        describe(chunk.header()),
                        describe(reference)));
            }
        }

        // Sized by the chunks received. The declared count and length size
        // nothing until every index is present and the bytes are counted.
        final int total = reference.totalChunks();
        final TreeMap<Integer, DecodedChunk> byIndex = new TreeMap<>();
        final TreeSet<Integer> duplicates = new TreeSet<>();

        for (DecodedChunk chunk : chunks) {
            final int index = chunk.header().chunkIndex();
            if (byIndex.putIfAbsent(index, chunk) != null) {
                duplicates.add(index);
            }
        }

        if (!duplicates.isEmpty()) {
            throw new ValidationException(
                    "Duplicate chunk index(es) " + duplicates + "; refusing to choose between copies");
        }

        if (byIndex.size() < total) {
            throw new MissingChunkException(new AbsentIndices(byIndex.keySet(), total), total);
        }

        final int fullLength = byIndex.get(0).chunk().dataLength();
        long available = 0;
        for (DecodedChunk chunk : byIndex.values()) {
            final int length = chunk.chunk().dataLength();
            if (!chunk.header().isLast() && length != fullLength) {
                throw new ValidationException(String.format(
                        "Chunk %d carries %d bytes; chunks before the last must carry %d",
                        chunk.header().chunkIndex(), length, fullLength));
            }
            available += length;
        }

        if (available < reference.streamLength()) {
            throw new ValidationException(String.format(
                    "Reassembled %d bytes but headers declare %d",
                    available, reference.streamLength()));
        }

        final byte[] stream = new byte[reference.streamLength()];
        int offset = 0;
        for (DecodedChunk chunk : byIndex.values()) {
            final byte[] data = chunk.chunk().data();
            final int take = Math.min(data.length, stream.length - offset);
            System.arraycopy(data, 0, stream, offset, take);
            offset += take;
        }

        return new ReassembledStream(stream, reference);
    }

    private static String describe(ChunkHeader h) {
        return "v" + h.version()
                + " total=" + h.totalChunks()
                + " length=" + h.streamLength()
                + " level=" + h.correctionLevel()
                + " encrypted=" + h.encrypted();
    }

    /**
     * A reassembled stream together with the stream-wide header values.
     */
    public static final class ReassembledStream
    {
        private final byte[] bytes;
        private final ChunkHeader reference;

        ReassembledStream(byte[] bytes, ChunkHeader reference) {
            this.bytes = bytes;
            this.reference = reference;
        }

        public byte[] bytes() {
            return bytes.clone();
        }

        public boolean encrypted() {
            return reference.encrypted();
        }
    }

    /**
     * The indices in {@code 0..total-1} that are absent from {@code present},
     * in ascending order. Computed on access, so a forged count costs nothing
     * until an index is read.
     */
    private static final class AbsentIndices extends AbstractList<Integer>
    {
        private final int[] present;
        private final int total;

        AbsentIndices(Collection<Integer> present, int total) {
            this.present = present.stream().mapToInt(Integer::intValue).sorted().toArray();
            this.total = total;
        }

        @Override
        public Integer get(int rank) {
            Objects.checkIndex(rank, size());
            // present[j] - j counts the absent indices below present[j]; it
            // never decreases, so the present indices at or below the answer
            // are exactly those with present[j] - j <= rank.
            int lo = 0;
            int hi = present.length;
            while (lo < hi) {
                final int mid = (lo + hi) >>> 1;
                if (present[mid] - mid <= rank) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            return rank + lo;
        }

        @Override
        public int size() {
            return total - present.length;
        }
    }
}
