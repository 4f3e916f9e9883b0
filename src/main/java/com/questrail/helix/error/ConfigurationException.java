package com.questrail.helix.error;

/**
 * Indicates that encode options cannot produce a valid chunk layout.
 *
 * <p>Raised before any chunk is produced, typically because the base length is
 * not a multiple of four, exceeds a single Reed-Solomon codeword, or leaves no
 * room for payload bytes once header and parity are accounted for.</p>
 */
public final class ConfigurationException extends DnaCodecException
{
    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }
}
