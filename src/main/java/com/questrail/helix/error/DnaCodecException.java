package com.questrail.helix.error;

import java.util.Objects;

/**
 * Base type for every failure reported by the codec.
 *
 * <p>Unchecked, like the rest of the decode-layer exceptions: a failure here
 * reflects bad input data or configuration, not a recoverable I/O condition.</p>
 */
public abstract class DnaCodecException extends RuntimeException
{
    private final ErrorKind kind;

    protected DnaCodecException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected DnaCodecException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
