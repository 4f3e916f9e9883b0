package com.questrail.helix.api;

import java.util.Collection;

/**
 * DnaCodec
 * =============================================================================
 * Public contract of the payload-to-nucleotide codec.
 *
 * <h2>What the codec does</h2>
 * <ul>
 *   <li>Optionally seals the payload with a password (PBKDF2 + AES-GCM)</li>
 *   <li>Splits the resulting stream into fixed-size chunks</li>
 *   <li>Prefixes each chunk with a self-describing header</li>
 *   <li>Appends Reed-Solomon parity to every chunk</li>
 *   <li>Maps every protected chunk to a string over {@code A, T, C, G}</li>
 * </ul>
 * Decoding reverses each step and repairs bounded corruption on the way.
 *
 * <h2>What the codec does not do</h2>
 * <ul>
 *   <li>Transport, authentication, file handling, archive packaging</li>
 *   <li>Altering sequences to satisfy synthesis constraints</li>
 *   <li>Retrying anything</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * All failures are reported as subclasses of
 * {@link com.questrail.helix.error.DnaCodecException}. Per-chunk decode
 * failures are collected across every sequence and reported together through
 * {@link com.questrail.helix.error.DecodeFailureException}.
 *
 * <h2>Thread safety</h2>
 * Implementations are stateless between calls and safe for concurrent use.
 */
public interface DnaCodec
{
    /**
     * Encodes a payload into nucleotide sequences.
     *
     * @param payload raw bytes, possibly empty
     * @param options password, base length and correction level
     * @return sequences in chunk index order plus aggregate metadata
     *
     * @throws com.questrail.helix.error.ConfigurationException if the base
     *         length cannot hold at least one payload byte per chunk
     */
    EncodeResult encode(byte[] payload, EncodeOptions options);

    /**
     * Decodes sequences produced by {@link #encode(byte[], EncodeOptions)}.
     *
     * <p>The sequences may be supplied in any order; each one carries its own
     * chunk index.</p>
     *
     * @param sequences encoded sequences, any order, case-insensitive
     * @param options   password and advisory correction level
     * @return the original payload
     *
     * @throws com.questrail.helix.error.DecodeFailureException if one or more
     *         sequences could not be validated
     * @throws com.questrail.helix.error.ValidationException if chunks disagree
     *         or repeat an index
     * @throws com.questrail.helix.error.MissingChunkException if an index is absent
     * @throws com.questrail.helix.error.AuthenticationException if the payload
     *         is encrypted and the password is missing or wrong
     */
    byte[] decode(Collection<String> sequences, DecodeOptions options);

    /**
     * Liveness probe. Performs no codec work.
     */
    HealthStatus health();
}
