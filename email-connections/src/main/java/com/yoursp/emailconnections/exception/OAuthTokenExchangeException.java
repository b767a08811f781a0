package com.yoursp.emailconnections.exception;

import org.springframework.http.HttpStatus;

import java.util.Collections;

public class OAuthTokenExchangeException extends ConnectionException {

    public OAuthTokenExchangeException(String reason, String providerError) {
        this(reason, providerError, null);
    }

    public OAuthTokenExchangeException(String reason, String providerError, Throwable cause) {
        super(HttpStatus.BAD_REQUEST,
                "OAUTH_TOKEN_FAILED",
                "OAuth token exchange failed: " + reason,
                "Failed to complete account connection.",
                RecoveryAction.RETRY,
                "Reason: " + reason + ", Provider Error: " + providerError,
                Collections.emptyMap(),
                cause);
    }
}
