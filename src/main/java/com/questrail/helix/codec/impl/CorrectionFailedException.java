package com.questrail.helix.codec.impl;

/**
 * Thrown by {@link ReedSolomonCoder#recover(byte[], com.questrail.helix.api.CorrectionLevel)}
 * when the corruption in a codeword exceeds the correction bound of the level
 * used to decode it.
 *
 * <p>Checked, and local to the codec layer: the chunk decoder translates it
 * into an {@link com.questrail.helix.error.UncorrectableChunkException}
 * carrying the sequence position.</p>
 */
public final class CorrectionFailedException extends Exception
{
    public CorrectionFailedException(String message)
    {
        super(message);
    }
}
