package com.questrail.helix.api;

import java.util.Objects;

/**
 * Aggregate description of an encode call.
 *
 * <p>This is informational only. It may travel separately from the sequences
 * and is never consulted by the decoder, which relies exclusively on the
 * per-chunk headers.</p>
 *
 * @param originalSize    payload size in bytes, before encryption
 * @param sequenceCount   number of sequences produced
 * @param baseLength      target sequence length in symbols
 * @param correctionLevel redundancy level applied to every chunk
 * @param encrypted       whether the payload was sealed with a password
 */
public record EncodeMetadata(
    int originalSize,
    int sequenceCount,
    int baseLength,
    CorrectionLevel correctionLevel,
    boolean encrypted
) {
    public EncodeMetadata {
        Objects.requireNonNull(correctionLevel, "correctionLevel");
    }
}
