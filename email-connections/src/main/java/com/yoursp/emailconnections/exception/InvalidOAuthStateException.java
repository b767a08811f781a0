package com.yoursp.emailconnections.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when an OAuth state parameter is missing, unknown, expired or already
 * consumed.
 */
public class InvalidOAuthStateException extends ConnectionException {

    public InvalidOAuthStateException(String reason) {
        super(HttpStatus.BAD_REQUEST,
                "OAUTH_INVALID_STATE",
                "OAuth state validation failed: " + reason,
                "Security validation failed during account connection.",
                RecoveryAction.RETRY,
                "Reason: " + reason);
    }
}
