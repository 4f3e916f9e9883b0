package com.questrail.helix.internal.crypto;

import com.questrail.helix.error.AuthenticationException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * PasswordCipher
 * =============================================================================
 * Password-based authenticated encryption of a whole payload.
 *
 * <h2>Construction</h2>
 * <ul>
 *   <li>Key: PBKDF2-HMAC-SHA256, 16-byte random salt, configurable iteration
 *       count, 256-bit output</li>
 *   <li>Cipher: AES-256-GCM, 12-byte random nonce, 128-bit tag</li>
 *   <li>AAD: the envelope preamble (version, iterations, salt, nonce)</li>
 * </ul>
 *
 * <p>Salt and nonce are drawn fresh from the supplied {@link SecureRandom} on
 * every {@link #seal(byte[], String)}; two seals of the same payload with the
 * same password never share either.</p>
 *
 * <p>The iteration count used at seal time travels in the envelope, so opening
 * does not depend on how the opening side is configured.</p>
 *
 * <h2>Thread safety</h2>
 * Instances are thread-safe: JCA objects are created per call and
 * {@link SecureRandom} is itself thread-safe.
 */
public final class PasswordCipher
{
    static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    static final String CIPHER_TRANSFORMATION = "AES/GCM/NoPadding";
    static final int KEY_BITS = 256;

    private final int iterations;
    private final SecureRandom random;

    public PasswordCipher(int iterations, SecureRandom random) {
        if (iterations < 1 || iterations > EncryptionEnvelope.MAX_ITERATIONS) {
            throw new IllegalArgumentException(
                    "iterations must be within 1.." + EncryptionEnvelope.MAX_ITERATIONS);
        }
        this.iterations = iterations;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Encrypts {@code plaintext} under a key derived from {@code password}.
     *
     * @return serialized {@link EncryptionEnvelope}
     */
    public byte[] seal(byte[] plaintext, String password) {
        Objects.requireNonNull(plaintext, "plaintext");
        requirePassword(password);

        final byte[] salt = new byte[EncryptionEnvelope.SALT_LENGTH];
        final byte[] nonce = new byte[EncryptionEnvelope.NONCE_LENGTH];
        random.nextBytes(salt);
        random.nextBytes(nonce);

        try {
            final SecretKeySpec key = deriveKey(password, salt, iterations);
            final Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key,
                    new GCMParameterSpec(EncryptionEnvelope.TAG_LENGTH * 8, nonce));
            cipher.updateAAD(EncryptionEnvelope.preamble(iterations, salt, nonce));
            final byte[] sealed = cipher.doFinal(plaintext);

            return new EncryptionEnvelope(iterations, salt, nonce, sealed).toBytes();
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encrypt failed", e);
        }
    }

    /**
     * Verifies and decrypts an envelope.
     *
     * @throws AuthenticationException if the password is missing or wrong, or
     *         the envelope was altered
     * @throws com.questrail.helix.error.ValidationException if the envelope is malformed
     */
    public byte[] open(byte[] envelopeBytes, String password) {
        Objects.requireNonNull(envelopeBytes, "envelopeBytes");
        if (password == null || password.isEmpty()) {
            throw new AuthenticationException("Payload is encrypted but no password was supplied");
        }

        final EncryptionEnvelope envelope = EncryptionEnvelope.parse(envelopeBytes);

        try {
            final SecretKeySpec key = deriveKey(password, envelope.salt(), envelope.iterations());
            final Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key,
                    new GCMParameterSpec(EncryptionEnvelope.TAG_LENGTH * 8, envelope.nonce()));
            cipher.updateAAD(envelope.preamble());
            return cipher.doFinal(envelope.sealed());
        }
        catch (AEADBadTagException e) {
            throw new AuthenticationException("Decryption failed: wrong password or tampered data", e);
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decrypt failed", e);
        }
    }

    static SecretKeySpec deriveKey(String password, byte[] salt, int iterations)
            throws GeneralSecurityException
    {
        final PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, iterations, KEY_BITS);
        try {
            final SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF_ALGORITHM);
            return new SecretKeySpec(factory.generateSecret(spec).getEncoded(), "AES");
        }
        finally {
            spec.clearPassword();
        }
    }

    private static void requirePassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password must be non-empty");
        }
    }
}
