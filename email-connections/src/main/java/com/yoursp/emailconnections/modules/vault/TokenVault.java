package com.yoursp.emailconnections.modules.vault;

import com.yoursp.emailconnections.config.EmailConnectionProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM encryption of provider tokens at rest.
 * <ul>
 * <li>Key derived once from the configured secret with PBKDF2-HMAC-SHA256
 * (fixed salt, 100 000 iterations)</li>
 * <li>12-byte random IV prepended to ciphertext, 128-bit tag</li>
 * <li>Output: Base64(IV || ciphertext || tag)</li>
 * </ul>
 * An absent token is stored as the empty string and decrypts back to it.
 */
@Component
public class TokenVault {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final byte[] KDF_SALT = "email_connection_salt_v1".getBytes(StandardCharsets.UTF_8);
    private static final int KDF_ITERATIONS = 100_000;
    private static final int KEY_LENGTH_BITS = 256;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKey key;

    public TokenVault(EmailConnectionProperties properties) {
        String secret = properties.getEncryptionSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("email-connections.encryption-secret must be configured");
        }
        this.key = deriveKey(secret);
    }

    /**
     * @param plaintext token to encrypt, may be null
     * @return Base64 ciphertext, or "" for a null or empty token
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return "";
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[IV_LENGTH + ciphertext.length];
            System.arraycopy(iv, 0, combined, 0, IV_LENGTH);
            System.arraycopy(ciphertext, 0, combined, IV_LENGTH, ciphertext.length);

            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-256-GCM encryption failed", e);
        }
    }

    /**
     * @param ciphertext value produced by {@link #encrypt}, may be null
     * @return plaintext, or "" for a null or empty input
     * @throws TokenDecryptionException if the value is malformed, was tampered
     *                                  with, or was encrypted under another key
     */
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            return "";
        }
        try {
            byte[] combined = Base64.getDecoder().decode(ciphertext);
            if (combined.length < IV_LENGTH + TAG_LENGTH_BITS / 8) {
                throw new TokenDecryptionException("ciphertext too short", null);
            }

            byte[] iv = Arrays.copyOfRange(combined, 0, IV_LENGTH);
            byte[] encrypted = Arrays.copyOfRange(combined, IV_LENGTH, combined.length);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new TokenDecryptionException("ciphertext is not valid Base64", e);
        } catch (GeneralSecurityException e) {
            throw new TokenDecryptionException("authentication tag mismatch or wrong key", e);
        }
    }

    private static SecretKey deriveKey(String secret) {
        PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), KDF_SALT, KDF_ITERATIONS, KEY_LENGTH_BITS);
        try {
            byte[] keyBytes = SecretKeyFactory.getInstance(KDF_ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
        }
    }
}
