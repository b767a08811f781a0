package com.yoursp.emailconnections.modules.oauth.dto;

public record OAuthInitiateResponse(
        String authorizationUrl,
        String state,
        String provider) {
}
