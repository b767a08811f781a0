package com.yoursp.emailconnections.exception;

import org.springframework.http.HttpStatus;

import java.util.Collections;

/**
 * The mailbox provider could not be reached or is failing server-side.
 */
public class ProviderServiceUnavailableException extends ConnectionException {

    public ProviderServiceUnavailableException(String service, String reason, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY,
                "EMAIL_SERVICE_UNAVAILABLE",
                service + " service error: " + reason,
                service + " service is temporarily unavailable.",
                RecoveryAction.RETRY,
                "Service: " + service + ", Reason: " + reason,
                Collections.emptyMap(),
                cause);
    }
}
