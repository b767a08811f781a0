package com.yoursp.emailconnections.modules.oauth.dto;

import java.time.Instant;

/**
 * What a state token stands for: who started the flow and where the provider
 * must send them back.
 */
public record OAuthStatePayload(
        Long userId,
        String redirectUri,
        Instant createdAt,
        Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
