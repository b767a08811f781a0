package com.yoursp.emailconnections.modules.oauth;

import com.yoursp.emailconnections.config.EmailConnectionProperties;
import com.yoursp.emailconnections.exception.InvalidOAuthStateException;
import com.yoursp.emailconnections.exception.OAuthTokenExchangeException;
import com.yoursp.emailconnections.exception.ValidationException;
import com.yoursp.emailconnections.modules.connections.ConnectionService;
import com.yoursp.emailconnections.modules.connections.dto.ConnectionResponse;
import com.yoursp.emailconnections.modules.connections.dto.NewConnection;
import com.yoursp.emailconnections.modules.oauth.dto.OAuthInitiateResponse;
import com.yoursp.emailconnections.modules.oauth.dto.OAuthStatePayload;
import com.yoursp.emailconnections.modules.oauth.dto.ProviderIdentity;
import com.yoursp.emailconnections.modules.oauth.dto.TokenGrant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Drives the authorization-code flow.
 * <p>
 * initiate → provider consent → callback. The state is validated before any
 * token exchange and consumed only after the connection is stored; a
 * provider-reported error consumes it immediately.
 * </p>
 */
@Slf4j
@Service
public class OAuthFlowService {

    private final OAuthStateStore stateStore;
    private final OAuthProviderClient providerClient;
    private final ConnectionService connectionService;
    private final EmailConnectionProperties.Google google;

    public OAuthFlowService(OAuthStateStore stateStore, OAuthProviderClient providerClient,
            ConnectionService connectionService, EmailConnectionProperties properties) {
        this.stateStore = stateStore;
        this.providerClient = providerClient;
        this.connectionService = connectionService;
        this.google = properties.getGoogle();
    }

    /**
     * @param redirectUri where the provider sends the user back; the configured
     *                    default when null
     * @param scopes      requested scopes; the configured defaults when empty
     */
    public OAuthInitiateResponse initiateAuthorization(Long userId, String redirectUri, List<String> scopes) {
        String effectiveRedirect = redirectUri != null && !redirectUri.isBlank()
                ? redirectUri
                : google.getDefaultRedirectUri();
        if (effectiveRedirect == null || effectiveRedirect.isBlank()) {
            throw new ValidationException("redirect_uri", "is required when no default is configured", null);
        }

        String state = stateStore.generate(userId, effectiveRedirect);
        String url = providerClient.authorizationUrl(effectiveRedirect, scopes, state);

        log.info("OAuth flow initiated for user {} (provider={})", userId, providerClient.provider());
        return new OAuthInitiateResponse(url, state, providerClient.provider());
    }

    /**
     * Handles the provider callback and stores the new connection.
     *
     * @param grantedScope  space-separated scopes from the callback, used when the
     *                      token response does not list them
     * @param providerError the callback's {@code error} parameter, if any
     */
    public ConnectionResponse completeAuthorization(String state, String code, String grantedScope,
            String providerError) {
        if (providerError != null && !providerError.isBlank()) {
            stateStore.consume(state);
            log.warn("Provider returned an authorization error: {}", providerError);
            throw new OAuthTokenExchangeException("authorization was not granted", providerError);
        }

        OAuthStatePayload payload = stateStore.validateAndPeek(state)
                .orElseThrow(() -> new InvalidOAuthStateException("state is unknown, expired or already used"));

        if (code == null || code.isBlank()) {
            throw new ValidationException("code", "is required", null);
        }

        TokenGrant grant = providerClient.exchangeCode(code, payload.redirectUri());
        ProviderIdentity identity = providerClient.fetchIdentity(grant.accessToken());

        ConnectionResponse connection = connectionService.create(new NewConnection(
                payload.userId(),
                providerClient.provider(),
                identity,
                grant.accessToken(),
                grant.refreshToken(),
                grant.expiresAt(),
                resolveScopes(grant, grantedScope)));

        if (!stateStore.consume(state)) {
            log.warn("OAuth state for connection {} was consumed concurrently", connection.id());
        }
        log.info("OAuth flow completed for user {}: connection {}", payload.userId(), connection.id());
        return connection;
    }

    private List<String> resolveScopes(TokenGrant grant, String grantedScope) {
        if (grant.scopes() != null && !grant.scopes().isEmpty()) {
            return grant.scopes();
        }
        if (grantedScope != null && !grantedScope.isBlank()) {
            return Arrays.asList(grantedScope.trim().split("\\s+"));
        }
        return google.getDefaultScopes();
    }
}
