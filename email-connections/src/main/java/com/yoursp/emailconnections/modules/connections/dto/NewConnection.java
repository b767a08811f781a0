package com.yoursp.emailconnections.modules.connections.dto;

import com.yoursp.emailconnections.modules.oauth.dto.ProviderIdentity;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Everything needed to persist a freshly authorized connection. Tokens are
 * plaintext here and are encrypted before they reach the entity.
 */
public record NewConnection(
        Long userId,
        String provider,
        ProviderIdentity identity,
        String accessToken,
        String refreshToken,
        OffsetDateTime tokenExpiresAt,
        List<String> scopes) {

    @Override
    public String toString() {
        return "NewConnection[userId=" + userId + ", provider=" + provider + ", email="
                + (identity != null ? identity.email() : null) + "]";
    }
}
