package com.yoursp.emailconnections.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Body of every error response, rendered under a top-level {@code "error"} key.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorEnvelope(
        String code,
        String message,
        String userMessage,
        RecoveryAction recoveryAction,
        String technicalDetails,
        Instant timestamp,
        String correlationId) {

    public static ErrorEnvelope from(ConnectionException ex, String correlationId) {
        return new ErrorEnvelope(
                ex.getErrorCode(),
                ex.getMessage(),
                ex.getUserMessage(),
                ex.getRecoveryAction(),
                ex.getTechnicalDetails(),
                Instant.now(),
                correlationId);
    }
}
