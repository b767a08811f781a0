package com.yoursp.emailconnections.exception;

import org.springframework.http.HttpStatus;

import java.util.Collections;

public class ConnectionHealthCheckException extends ConnectionException {

    public ConnectionHealthCheckException(Long connectionId, String healthError, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE,
                "CONNECTION_HEALTH_FAILED",
                "Health check failed for connection " + connectionId,
                "Email connection health check failed.",
                RecoveryAction.RETRY,
                "Connection " + connectionId + ", Error: " + healthError,
                Collections.emptyMap(),
                cause);
    }
}
