package com.yoursp.emailconnections.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.Map;

/**
 * Base of the closed set of failures raised by the connection subsystem.
 * {@code userMessage} is safe to show to an end user; {@code technicalDetails}
 * is operator detail and is sanitized before it is stored here.
 */
@Getter
public abstract class ConnectionException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;
    private final String userMessage;
    private final RecoveryAction recoveryAction;
    private final String technicalDetails;
    private final Map<String, String> headers;

    protected ConnectionException(HttpStatus status, String errorCode, String message, String userMessage,
            RecoveryAction recoveryAction, String technicalDetails) {
        this(status, errorCode, message, userMessage, recoveryAction, technicalDetails, Collections.emptyMap(), null);
    }

    protected ConnectionException(HttpStatus status, String errorCode, String message, String userMessage,
            RecoveryAction recoveryAction, String technicalDetails, Map<String, String> headers, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
        this.userMessage = userMessage;
        this.recoveryAction = recoveryAction;
        this.technicalDetails = ErrorMessageSanitizer.sanitize(technicalDetails);
        this.headers = headers;
    }
}
