package com.yoursp.emailconnections.modules.connections.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yoursp.emailconnections.model.ConnectionStatus;
import com.yoursp.emailconnections.model.entity.EmailConnection;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Public view of a connection. Carries no token material.
 */
public record ConnectionResponse(
        Long id,
        String emailAddress,
        String provider,
        String connectionName,
        ConnectionStatus connectionStatus,
        String errorMessage,
        List<String> scopesGranted,
        OffsetDateTime tokenExpiresAt,
        boolean hasRefreshToken,
        OffsetDateTime lastSyncAt,
        @JsonProperty("is_archived") boolean archived,
        OffsetDateTime archivedAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt) {

    public static ConnectionResponse from(EmailConnection connection) {
        return new ConnectionResponse(
                connection.getId(),
                connection.getEmailAddress(),
                connection.getProvider(),
                connection.getConnectionName(),
                connection.getStatus(),
                connection.getErrorMessage(),
                connection.getScopesGranted() != null ? List.copyOf(connection.getScopesGranted()) : List.of(),
                connection.getTokenExpiresAt(),
                connection.hasRefreshToken(),
                connection.getLastSyncAt(),
                connection.isArchived(),
                connection.getArchivedAt(),
                connection.getCreatedAt(),
                connection.getUpdatedAt());
    }
}
