package com.questrail.helix.error;

/**
 * Indicates that an encrypted payload could not be opened: the password is
 * missing or wrong, or the envelope was altered after sealing.
 *
 * <p>This is always fatal for the call. The codec never returns plaintext that
 * failed authentication.</p>
 */
public final class AuthenticationException extends DnaCodecException
{
    public AuthenticationException(String message) {
        super(ErrorKind.AUTHENTICATION, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, message, cause);
    }
}
