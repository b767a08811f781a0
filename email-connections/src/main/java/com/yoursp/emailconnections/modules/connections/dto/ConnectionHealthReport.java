package com.yoursp.emailconnections.modules.connections.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yoursp.emailconnections.model.ConnectionStatus;

import java.time.OffsetDateTime;

public record ConnectionHealthReport(
        Long connectionId,
        @JsonProperty("is_healthy") boolean healthy,
        ConnectionStatus status,
        OffsetDateTime lastChecked,
        String errorDetails,
        OffsetDateTime tokenExpiresAt,
        boolean needsReauth) {
}
