package com.yoursp.emailconnections.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ConnectionAlreadyExistsException extends ConnectionException {

    private final Long existingId;

    public ConnectionAlreadyExistsException(String emailAddress, Long existingId) {
        super(HttpStatus.CONFLICT,
                "CONNECTION_ALREADY_EXISTS",
                "Connection already exists for " + emailAddress,
                "This email account is already connected.",
                RecoveryAction.NONE,
                "Existing connection ID: " + existingId);
        this.existingId = existingId;
    }
}
