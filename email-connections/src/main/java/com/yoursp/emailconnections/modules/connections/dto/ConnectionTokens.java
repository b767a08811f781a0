package com.yoursp.emailconnections.modules.connections.dto;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Decrypted credentials handed to in-process callers that act on the mailbox.
 * Never serialized into a response.
 */
public record ConnectionTokens(
        String accessToken,
        String refreshToken,
        OffsetDateTime expiresAt,
        List<String> scopes) {

    @Override
    public String toString() {
        return "ConnectionTokens[expiresAt=" + expiresAt + ", scopes=" + scopes + "]";
    }
}
