package com.yoursp.emailconnections.modules.connections.dto;

public record ConnectionDeleteResponse(
        Long connectionId,
        String emailAddress,
        boolean archived,
        boolean revokedAtProvider,
        String message) {
}
