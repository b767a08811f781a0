package com.yoursp.emailconnections.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ValidationException extends ConnectionException {

    private final String field;

    public ValidationException(String field, String message, String value) {
        super(HttpStatus.UNPROCESSABLE_ENTITY,
                "VALIDATION_FAILED",
                "Validation failed for " + field + ": " + message,
                "Invalid " + field + ": " + message,
                RecoveryAction.NONE,
                "Field: " + field + ", Value: " + value + ", Message: " + message);
        this.field = field;
    }
}
