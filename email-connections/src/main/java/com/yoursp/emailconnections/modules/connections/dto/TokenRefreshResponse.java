package com.yoursp.emailconnections.modules.connections.dto;

import java.time.OffsetDateTime;

public record TokenRefreshResponse(
        Long connectionId,
        boolean success,
        OffsetDateTime newExpiresAt,
        String message) {
}
