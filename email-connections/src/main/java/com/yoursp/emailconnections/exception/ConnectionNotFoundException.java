package com.yoursp.emailconnections.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ConnectionNotFoundException extends ConnectionException {

    private final Long connectionId;

    public ConnectionNotFoundException(Long connectionId, Long userId) {
        super(HttpStatus.NOT_FOUND,
                "CONNECTION_NOT_FOUND",
                "Email connection " + connectionId + " not found",
                "The email connection could not be found.",
                RecoveryAction.REFRESH,
                "Connection ID " + connectionId + " for user " + userId);
        this.connectionId = connectionId;
    }
}
