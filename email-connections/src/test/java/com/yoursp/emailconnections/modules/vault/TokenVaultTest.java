package com.yoursp.emailconnections.modules.vault;

import com.yoursp.emailconnections.config.EmailConnectionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class TokenVaultTest {

    private TokenVault vault;

    @BeforeEach
    void setUp() {
        vault = new TokenVault(properties("test-encryption-secret"));
    }

    @Test
    @DisplayName("decrypt(encrypt(s)) returns s")
    void roundTrip() {
        String token = "ya29.a0AfH6SMBx-example-access-token";

        String encrypted = vault.encrypt(token);

        assertNotEquals(token, encrypted);
        assertEquals(token, vault.decrypt(encrypted));
    }

    @Test
    @DisplayName("Encrypting the same value twice yields different ciphertexts")
    void randomIvPerEncryption() {
        String first = vault.encrypt("same-token");
        String second = vault.encrypt("same-token");

        assertNotEquals(first, second);
        assertEquals("same-token", vault.decrypt(first));
        assertEquals("same-token", vault.decrypt(second));
    }

    @Test
    @DisplayName("Output is Base64 of IV + ciphertext + tag")
    void outputLayout() {
        byte[] raw = Base64.getDecoder().decode(vault.encrypt("abc"));

        // 12-byte IV + 3 bytes ciphertext + 16-byte tag
        assertEquals(12 + 3 + 16, raw.length);
    }

    @Test
    @DisplayName("Absent tokens are stored as empty strings")
    void emptyAndNull() {
        assertEquals("", vault.encrypt(null));
        assertEquals("", vault.encrypt(""));
        assertEquals("", vault.decrypt(""));
        assertEquals("", vault.decrypt(null));
    }

    @Test
    @DisplayName("Tampered ciphertext fails with TokenDecryptionException")
    void tamperedCiphertext() {
        byte[] raw = Base64.getDecoder().decode(vault.encrypt("refresh-token"));
        raw[raw.length - 1] ^= 0x01;
        String tampered = Base64.getEncoder().encodeToString(raw);

        assertThrows(TokenDecryptionException.class, () -> vault.decrypt(tampered));
    }

    @Test
    @DisplayName("Malformed input fails with TokenDecryptionException")
    void malformedCiphertext() {
        assertThrows(TokenDecryptionException.class, () -> vault.decrypt("not base64 !!"));
        assertThrows(TokenDecryptionException.class, () -> vault.decrypt("c2hvcnQ="));
    }

    @Test
    @DisplayName("A value encrypted under another secret cannot be decrypted")
    void wrongKey() {
        TokenVault other = new TokenVault(properties("a-different-secret"));

        String encrypted = other.encrypt("token");

        assertThrows(TokenDecryptionException.class, () -> vault.decrypt(encrypted));
    }

    @Test
    @DisplayName("Same secret derives the same key across instances")
    void keyDerivationIsStable() {
        TokenVault second = new TokenVault(properties("test-encryption-secret"));

        assertEquals("token", second.decrypt(vault.encrypt("token")));
    }

    @Test
    void missingSecretFailsFast() {
        assertThrows(IllegalStateException.class, () -> new TokenVault(properties(" ")));
    }

    private static EmailConnectionProperties properties(String secret) {
        EmailConnectionProperties properties = new EmailConnectionProperties();
        properties.setEncryptionSecret(secret);
        return properties;
    }
}
