package com.yoursp.emailconnections.modules.connections.dto;

import com.yoursp.emailconnections.model.ConnectionStatus;

import java.time.OffsetDateTime;

public record ConnectionStatusSummary(
        Long connectionId,
        String emailAddress,
        ConnectionStatus status,
        OffsetDateTime lastSyncAt,
        String errorMessage) {
}
