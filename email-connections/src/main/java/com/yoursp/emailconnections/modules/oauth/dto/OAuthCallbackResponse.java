package com.yoursp.emailconnections.modules.oauth.dto;

import com.yoursp.emailconnections.modules.connections.dto.ConnectionResponse;

public record OAuthCallbackResponse(
        boolean success,
        String message,
        ConnectionResponse connection) {
}
