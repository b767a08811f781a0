package com.yoursp.emailconnections.exception;

import org.springframework.http.HttpStatus;

public class ConnectionRevokedException extends ConnectionException {

    public ConnectionRevokedException(Long connectionId, String emailAddress) {
        super(HttpStatus.FORBIDDEN,
                "CONNECTION_REVOKED",
                "Connection " + connectionId + " has been revoked",
                "Access to your email account has been revoked.",
                RecoveryAction.RE_AUTHORIZE,
                "Connection " + connectionId + " (" + emailAddress + ") was revoked at the provider");
    }
}
