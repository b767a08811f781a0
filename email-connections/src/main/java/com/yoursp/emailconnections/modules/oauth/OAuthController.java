package com.yoursp.emailconnections.modules.oauth;

import com.yoursp.emailconnections.config.AuthenticatedUser;
import com.yoursp.emailconnections.modules.connections.dto.ConnectionResponse;
import com.yoursp.emailconnections.modules.oauth.dto.OAuthCallbackResponse;
import com.yoursp.emailconnections.modules.oauth.dto.OAuthInitiateRequest;
import com.yoursp.emailconnections.modules.oauth.dto.OAuthInitiateResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

/**
 * Gmail OAuth authorization-code flow.
 * <p>
 * /oauth/initiate → Google consent screen → /oauth/callback → new connection
 */
@RestController
@RequestMapping("/api/v1/email-connections/oauth")
@RequiredArgsConstructor
public class OAuthController {

    private final OAuthFlowService flowService;

    // ================================================================
    // POST /oauth/initiate: Build the consent-screen URL
    // ================================================================

    @PostMapping("/initiate")
    public ResponseEntity<OAuthInitiateResponse> initiate(@AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody(required = false) OAuthInitiateRequest request) {
        OAuthInitiateRequest body = request != null ? request : new OAuthInitiateRequest();
        return ResponseEntity.ok(flowService.initiateAuthorization(
                AuthenticatedUser.id(jwt), body.getRedirectUri(), body.getScopes()));
    }

    // ================================================================
    // GET /oauth/callback: Exchange the code and store the connection
    // ================================================================

    @GetMapping("/callback")
    public ResponseEntity<OAuthCallbackResponse> callback(
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "code", required = false) String code,
            @RequestParam(value = "scope", required = false) String scope,
            @RequestParam(value = "error", required = false) String error) {

        ConnectionResponse connection = flowService.completeAuthorization(state, code, scope, error);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new OAuthCallbackResponse(true, "Email account connected", connection));
    }
}
