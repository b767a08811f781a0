package com.yoursp.emailconnections.modules.oauth.dto;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Result of a code exchange or refresh. {@code refreshToken} is null when the
 * provider did not issue a new one; {@code expiresAt} is computed locally from
 * {@code expires_in} and is null if the provider sent none.
 */
public record TokenGrant(
        String accessToken,
        String refreshToken,
        OffsetDateTime expiresAt,
        List<String> scopes) {
}
