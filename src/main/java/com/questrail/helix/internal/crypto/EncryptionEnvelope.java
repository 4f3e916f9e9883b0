package com.questrail.helix.internal.crypto;

import com.questrail.helix.error.ValidationException;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * EncryptionEnvelope
 * -----------------------------------------------------------------------------
 * Self-describing container for a password-sealed payload.
 *
 * <pre>
 *   offset  size  field
 *   ------  ----  ------------------------------------------
 *        0     1  envelope version ($01)
 *        1     4  PBKDF2 iteration count, big-endian
 *        5    16  salt
 *       21    12  AES-GCM nonce
 *       33     n  ciphertext ‖ 16-byte authentication tag
 * </pre>
 *
 * <p>The first {@value #PREAMBLE_LENGTH} bytes form the preamble. It is bound to
 * the ciphertext as additional authenticated data, so altering the iteration
 * count, salt or nonce fails authentication just like altering the
 * ciphertext.</p>
 *
 * <p>The envelope is the stream that gets chunked; its preamble is therefore
 * error-corrected like any other data and only read after reassembly.</p>
 */
public final class EncryptionEnvelope
{
    public static final int VERSION = 1;
    public static final int SALT_LENGTH = 16;
    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;
    public static final int PREAMBLE_LENGTH = 1 + 4 + SALT_LENGTH + NONCE_LENGTH;

    /** Upper bound accepted when reading an envelope, so a corrupted count cannot stall key derivation. */
    public static final int MAX_ITERATIONS = 10_000_000;

    private final int iterations;
    private final byte[] salt;
    private final byte[] nonce;
    private final byte[] sealed;

    EncryptionEnvelope(int iterations, byte[] salt, byte[] nonce, byte[] sealed) {
        if (iterations < 1 || iterations > MAX_ITERATIONS) {
            throw new IllegalArgumentException("iterations outside 1.." + MAX_ITERATIONS);
        }
        if (Objects.requireNonNull(salt, "salt").length != SALT_LENGTH) {
            throw new IllegalArgumentException("salt must be " + SALT_LENGTH + " bytes");
        }
        if (Objects.requireNonNull(nonce, "nonce").length != NONCE_LENGTH) {
            throw new IllegalArgumentException("nonce must be " + NONCE_LENGTH + " bytes");
        }
        if (Objects.requireNonNull(sealed, "sealed").length < TAG_LENGTH) {
            throw new IllegalArgumentException("sealed data shorter than the tag");
        }
        this.iterations = iterations;
        this.salt = salt.clone();
        this.nonce = nonce.clone();
        this.sealed = sealed.clone();
    }

    /**
     * Parses an envelope.
     *
     * @throws ValidationException if the bytes are too short, carry an unknown
     *         version or an out-of-range iteration count
     */
    public static EncryptionEnvelope parse(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length < PREAMBLE_LENGTH + TAG_LENGTH) {
            throw new ValidationException(String.format(
                    "Encrypted stream of %d bytes is shorter than the %d-byte minimum envelope",
                    bytes.length, PREAMBLE_LENGTH + TAG_LENGTH));
        }

        final ByteBuffer buf = ByteBuffer.wrap(bytes);
        final int version = buf.get() & 0xFF;
        if (version != VERSION) {
            throw new ValidationException("Unsupported envelope version " + version);
        }

        final int iterations = buf.getInt();
        if (iterations < 1 || iterations > MAX_ITERATIONS) {
            throw new ValidationException(
                    "Envelope iteration count " + iterations + " outside 1.." + MAX_ITERATIONS);
        }

        final byte[] salt = new byte[SALT_LENGTH];
        buf.get(salt);
        final byte[] nonce = new byte[NONCE_LENGTH];
        buf.get(nonce);
        final byte[] sealed = new byte[buf.remaining()];
        buf.get(sealed);

        return new EncryptionEnvelope(iterations, salt, nonce, sealed);
    }

    /**
     * Serializes the envelope.
     */
    public byte[] toBytes() {
        return ByteBuffer.allocate(PREAMBLE_LENGTH + sealed.length)
                .put(preamble())
                .put(sealed)
                .array();
    }

    /**
     * Returns the bytes authenticated alongside the ciphertext.
     */
    byte[] preamble() {
        return preamble(iterations, salt, nonce);
    }

    static byte[] preamble(int iterations, byte[] salt, byte[] nonce) {
        return ByteBuffer.allocate(PREAMBLE_LENGTH)
                .put((byte) VERSION)
                .putInt(iterations)
                .put(salt)
                .put(nonce)
                .array();
    }

    public int iterations() {
        return iterations;
    }

    public byte[] salt() {
        return salt.clone();
    }

    public byte[] nonce() {
        return nonce.clone();
    }

    /**
     * Returns ciphertext followed by the authentication tag.
     */
    public byte[] sealed() {
        return sealed.clone();
    }

    @Override
    public String toString() {
        return "EncryptionEnvelope[" +
                "iterations=" + iterations +
                ", sealedLength=" + sealed.length +
                ']';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncryptionEnvelope other)) {
            return false;
        }
        return iterations == other.iterations
                && Arrays.equals(salt, other.salt)
                && Arrays.equals(nonce, other.nonce)
                && Arrays.equals(sealed, other.sealed);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(iterations);
        result = 31 * result + Arrays.hashCode(salt);
        result = 31 * result + Arrays.hashCode(nonce);
        result = 31 * result + Arrays.hashCode(sealed);
        return result;
    }
}
