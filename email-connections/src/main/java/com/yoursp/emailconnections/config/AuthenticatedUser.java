package com.yoursp.emailconnections.config;

import com.yoursp.emailconnections.exception.ValidationException;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Resolves the caller's user id from the bearer token subject.
 */
public final class AuthenticatedUser {

    private AuthenticatedUser() {
    }

    public static Long id(Jwt jwt) {
        String subject = jwt != null ? jwt.getSubject() : null;
        try {
            return Long.valueOf(subject);
        } catch (NumberFormatException e) {
            throw new ValidationException("sub", "token subject is not a user id", subject);
        }
    }
}
