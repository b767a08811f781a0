package com.yoursp.emailconnections.modules.oauth;

import com.yoursp.emailconnections.exception.ConnectionException;
import com.yoursp.emailconnections.modules.oauth.dto.ProviderIdentity;
import com.yoursp.emailconnections.modules.oauth.dto.TokenGrant;

import java.util.List;

/**
 * Outbound calls to an OAuth 2.0 authorization server.
 */
public interface OAuthProviderClient {

    /** Provider name stored on connections, e.g. {@code gmail}. */
    String provider();

    String authorizationUrl(String redirectUri, List<String> scopes, String state);

    /**
     * @throws com.yoursp.emailconnections.exception.OAuthTokenExchangeException if
     *         the provider rejects the code or returns no access token
     */
    TokenGrant exchangeCode(String code, String redirectUri);

    /**
     * @throws com.yoursp.emailconnections.exception.TokenRefreshException if the
     *         refresh token is rejected or the provider is unreachable
     */
    TokenGrant refresh(String refreshToken);

    /**
     * @throws com.yoursp.emailconnections.exception.IdentityFetchException if the
     *         call fails or the identity carries no email address
     */
    ProviderIdentity fetchIdentity(String accessToken);

    /**
     * Best effort. Never throws.
     *
     * @return true if the provider confirmed the revocation
     */
    boolean revoke(String token);

    default boolean validateToken(String accessToken) {
        try {
            fetchIdentity(accessToken);
            return true;
        } catch (ConnectionException e) {
            return false;
        }
    }
}
