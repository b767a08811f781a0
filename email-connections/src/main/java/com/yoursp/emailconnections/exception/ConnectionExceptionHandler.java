package com.yoursp.emailconnections.exception;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

/**
 * Renders {@link ConnectionException}s and framework errors as
 * {@code {"error": {...}}}. Stack traces are never exposed in response bodies.
 */
@Slf4j
@RestControllerAdvice
public class ConnectionExceptionHandler {

    private static final String CORRELATION_ID_KEY = "correlationId";

    @ExceptionHandler(ConnectionException.class)
    public ResponseEntity<Map<String, ErrorEnvelope>> handleConnectionException(ConnectionException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("{} [{}]: {}", ex.getErrorCode(), ex.getStatus().value(), ex.getTechnicalDetails());
        } else {
            log.warn("{} [{}]: {}", ex.getErrorCode(), ex.getStatus().value(), ex.getMessage());
        }

        HttpHeaders headers = new HttpHeaders();
        ex.getHeaders().forEach(headers::add);

        return ResponseEntity.status(ex.getStatus())
                .headers(headers)
                .body(Map.of("error", ErrorEnvelope.from(ex, MDC.get(CORRELATION_ID_KEY))));
    }

    /**
     * Bean-validation failures on request bodies map to VALIDATION_FAILED for the
     * first offending field.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, ErrorEnvelope>> handleValidationException(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        ValidationException mapped = fieldError != null
                ? new ValidationException(fieldError.getField(), fieldError.getDefaultMessage(),
                        String.valueOf(fieldError.getRejectedValue()))
                : new ValidationException("request", "invalid request body", null);

        log.warn("Validation failed: {} field error(s)", ex.getBindingResult().getFieldErrorCount());
        return handleConnectionException(mapped);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, ErrorEnvelope>> handleMissingParameter(
            MissingServletRequestParameterException ex) {
        return handleConnectionException(
                new ValidationException(ex.getParameterName(), "parameter is required", null));
    }

    /** Path or query values of the wrong type, such as a non-numeric id. */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, ErrorEnvelope>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "value";
        return handleConnectionException(new ValidationException(ex.getName(),
                "must be a valid " + expected, String.valueOf(ex.getValue())));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, ErrorEnvelope>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return handleConnectionException(new ValidationException("request", "malformed JSON body", null));
    }

    /**
     * Catch-all. Returns 500 with the correlation ID only.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, ErrorEnvelope>> handleGenericException(Exception ex) {
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        log.error("Unhandled exception [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        ErrorEnvelope body = new ErrorEnvelope(
                "INTERNAL_ERROR",
                "An unexpected error occurred. Please reference correlationId for support.",
                "Something went wrong. Please try again later.",
                RecoveryAction.RETRY,
                null,
                Instant.now(),
                correlationId);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", body));
    }
}
