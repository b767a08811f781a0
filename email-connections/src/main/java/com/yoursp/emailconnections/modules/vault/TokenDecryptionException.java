package com.yoursp.emailconnections.modules.vault;

/**
 * Stored token material could not be decrypted. Callers treat the connection as
 * unusable rather than surfacing this to end users.
 */
public class TokenDecryptionException extends RuntimeException {

    public TokenDecryptionException(String message, Throwable cause) {
        super("Token decryption failed: " + message, cause);
    }
}
