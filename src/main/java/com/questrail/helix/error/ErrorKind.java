package com.questrail.helix.error;

/**
 * Classification of codec failures.
 *
 * <p>Callers map these to their own retry or status policies; the codec itself
 * never retries.</p>
 */
public enum ErrorKind
{
    /** Base length and correction level cannot produce a usable chunk. */
    CONFIGURATION,

    /** Malformed alphabet, inconsistent header, duplicate or disagreeing chunks. */
    VALIDATION,

    /** Corruption in a chunk exceeds what its parity can repair. */
    UNCORRECTABLE,

    /** A chunk decoded without error but its data checksum does not match. */
    CHECKSUM_MISMATCH,

    /** One or more chunk indices are absent from the supplied sequences. */
    MISSING_CHUNK,

    /** Password missing or wrong, or the ciphertext was tampered with. */
    AUTHENTICATION
}
