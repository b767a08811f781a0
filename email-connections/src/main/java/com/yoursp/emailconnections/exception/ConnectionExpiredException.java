package com.yoursp.emailconnections.exception;

import org.springframework.http.HttpStatus;

public class ConnectionExpiredException extends ConnectionException {

    public ConnectionExpiredException(Long connectionId, String emailAddress) {
        super(HttpStatus.UNAUTHORIZED,
                "CONNECTION_EXPIRED",
                "Connection " + connectionId + " has expired",
                "Your email account connection has expired.",
                RecoveryAction.RE_AUTHORIZE,
                "Connection " + connectionId + " (" + emailAddress + ") requires re-authorization");
    }
}
