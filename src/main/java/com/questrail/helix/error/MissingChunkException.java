package com.questrail.helix.error;

import java.util.Collections;
import java.util.List;

/**
 * Indicates that the supplied sequences do not cover every chunk index from
 * {@code 0} to {@code total - 1}.
 *
 * <p>The missing-index list is held as given rather than copied, since it may
 * be a computed view over a very large range. The message names at most the
 * first {@value #MESSAGE_LIMIT} indices.</p>
 */
public final class MissingChunkException extends DnaCodecException
{
    static final int MESSAGE_LIMIT = 16;

    private final List<Integer> missingIndices;
    private final int totalChunks;

    public MissingChunkException(List<Integer> missingIndices, int totalChunks) {
        super(ErrorKind.MISSING_CHUNK, describe(missingIndices, totalChunks));
        this.missingIndices = Collections.unmodifiableList(missingIndices);
        this.totalChunks = totalChunks;
    }

    private static String describe(List<Integer> missing, int total) {
        if (missing.size() <= MESSAGE_LIMIT) {
            return "Missing chunk index(es) " + missing + " of " + total;
        }
        return "Missing " + missing.size() + " chunk indices of " + total
                + ", starting " + missing.subList(0, MESSAGE_LIMIT);
    }

    /**
     * Returns every missing index in ascending order.
     */
    public List<Integer> missingIndices() {
        return missingIndices;
    }

    public int totalChunks() {
        return totalChunks;
    }
}
