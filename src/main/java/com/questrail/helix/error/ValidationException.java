package com.questrail.helix.error;

/**
 * Indicates structurally invalid input to the decoder.
 *
 * This typically reflects:
 * <ul>
 *   <li>Characters outside {@code A, T, C, G} or a length not divisible by four</li>
 *   <li>An unknown header version or level, or an index beyond the total count</li>
 *   <li>Chunks that disagree on total count, stream length, level or encryption</li>
 *   <li>The same chunk index supplied more than once</li>
 *   <li>A malformed encryption envelope</li>
 * </ul>
 */
public final class ValidationException extends DnaCodecException
{
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
