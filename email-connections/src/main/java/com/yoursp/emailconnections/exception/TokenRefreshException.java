package com.yoursp.emailconnections.exception;

import org.springframework.http.HttpStatus;

import java.util.Collections;

public class TokenRefreshException extends ConnectionException {

    public TokenRefreshException(Long connectionId, String reason) {
        this(connectionId, reason, null);
    }

    public TokenRefreshException(Long connectionId, String reason, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED,
                "TOKEN_REFRESH_FAILED",
                "Token refresh failed" + (connectionId != null ? " for connection " + connectionId : "")
                        + ": " + reason,
                "Unable to refresh your email account connection.",
                RecoveryAction.RE_AUTHORIZE,
                "Connection " + connectionId + ", Reason: " + reason,
                Collections.emptyMap(),
                cause);
    }
}
