package com.yoursp.emailconnections.modules.oauth;

import com.yoursp.emailconnections.config.EmailConnectionProperties;
import com.yoursp.emailconnections.exception.ConnectionException;
import com.yoursp.emailconnections.exception.ErrorMessageSanitizer;
import com.yoursp.emailconnections.exception.IdentityFetchException;
import com.yoursp.emailconnections.exception.OAuthTokenExchangeException;
import com.yoursp.emailconnections.exception.TokenRefreshException;
import com.yoursp.emailconnections.modules.oauth.dto.ProviderIdentity;
import com.yoursp.emailconnections.modules.oauth.dto.TokenGrant;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Google OAuth 2.0 client for Gmail connections.
 * <p>
 * Authorization requests ask for offline access with forced consent so that a
 * refresh token is issued on every grant. Token and user-info calls are guarded
 * by the {@code googleOAuth} circuit breaker; every failure surfaces as a typed
 * {@link ConnectionException} with a sanitized message.
 * </p>
 */
@Slf4j
@Component
public class GoogleOAuthClient implements OAuthProviderClient {

    public static final String PROVIDER = "gmail";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP = new ParameterizedTypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final EmailConnectionProperties.Google google;
    private final Clock clock;

    public GoogleOAuthClient(RestTemplate restTemplate, EmailConnectionProperties properties, Clock clock) {
        this.restTemplate = restTemplate;
        this.google = properties.getGoogle();
        this.clock = clock;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public String authorizationUrl(String redirectUri, List<String> scopes, String state) {
        List<String> effectiveScopes = scopes == null || scopes.isEmpty() ? google.getDefaultScopes() : scopes;

        return UriComponentsBuilder.fromHttpUrl(google.getAuthorizationUrl())
                .queryParam("client_id", google.getClientId())
                .queryParam("response_type", "code")
                .queryParam("scope", String.join(" ", effectiveScopes))
                .queryParam("redirect_uri", redirectUri)
                .queryParam("state", state)
                .queryParam("access_type", "offline")
                .queryParam("prompt", "consent")
                .queryParam("include_granted_scopes", "true")
                .encode()
                .build()
                .toUriString();
    }

    // ================================================================
    // POST token endpoint: authorization_code grant
    // ================================================================

    @Override
    @CircuitBreaker(name = "googleOAuth", fallbackMethod = "exchangeCodeFallback")
    public TokenGrant exchangeCode(String code, String redirectUri) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", google.getClientId());
        body.add("client_secret", google.getClientSecret());
        body.add("code", code);
        body.add("grant_type", "authorization_code");
        body.add("redirect_uri", redirectUri);

        Map<String, Object> response;
        try {
            response = postForm(body);
        } catch (RestClientResponseException e) {
            throw new OAuthTokenExchangeException("provider rejected the authorization code",
                    ErrorMessageSanitizer.sanitize(e.getResponseBodyAsString()), e);
        } catch (RestClientException e) {
            throw new OAuthTokenExchangeException("token endpoint unreachable",
                    ErrorMessageSanitizer.sanitize(e.getMessage()), e);
        }

        TokenGrant grant = toGrant(response);
        if (grant.accessToken() == null) {
            throw new OAuthTokenExchangeException("no access token in token response", null);
        }
        log.info("Google code exchange succeeded (refreshToken={}, expiresAt={})",
                grant.refreshToken() != null, grant.expiresAt());
        return grant;
    }

    // ================================================================
    // POST token endpoint: refresh_token grant
    // ================================================================

    @Override
    @CircuitBreaker(name = "googleOAuth", fallbackMethod = "refreshFallback")
    public TokenGrant refresh(String refreshToken) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", google.getClientId());
        body.add("client_secret", google.getClientSecret());
        body.add("refresh_token", refreshToken);
        body.add("grant_type", "refresh_token");

        Map<String, Object> response;
        try {
            response = postForm(body);
        } catch (RestClientResponseException e) {
            throw new TokenRefreshException(null,
                    "provider rejected refresh: " + ErrorMessageSanitizer.sanitize(e.getResponseBodyAsString()), e);
        } catch (RestClientException e) {
            throw new TokenRefreshException(null,
                    "token endpoint unreachable: " + ErrorMessageSanitizer.sanitize(e.getMessage()), e);
        }

        TokenGrant grant = toGrant(response);
        if (grant.accessToken() == null) {
            throw new TokenRefreshException(null, "no access token in refresh response");
        }
        log.debug("Google token refresh succeeded (expiresAt={})", grant.expiresAt());
        return grant;
    }

    // ================================================================
    // GET userinfo
    // ================================================================

    @Override
    @CircuitBreaker(name = "googleOAuth", fallbackMethod = "fetchIdentityFallback")
    public ProviderIdentity fetchIdentity(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ProviderIdentity identity;
        try {
            ResponseEntity<ProviderIdentity> response = restTemplate.exchange(
                    google.getUserinfoUrl(),
                    HttpMethod.GET,
                    new HttpEntity<>(headers),
                    ProviderIdentity.class);
            identity = response.getBody();
        } catch (RestClientException e) {
            throw new IdentityFetchException(ErrorMessageSanitizer.sanitize(e.getMessage()), e);
        }

        if (identity == null || identity.email() == null || identity.email().isBlank()) {
            throw new IdentityFetchException("email not present in user info", null);
        }
        return identity;
    }

    // ================================================================
    // POST revoke: best effort
    // ================================================================

    @Override
    public boolean revoke(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("token", token);

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    google.getRevokeUrl(),
                    HttpMethod.POST,
                    new HttpEntity<>(body, headers),
                    String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.warn("Google token revocation failed: {}", ErrorMessageSanitizer.sanitize(e.getMessage()));
            return false;
        }
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private Map<String, Object> postForm(MultiValueMap<String, String> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                google.getTokenUrl(),
                HttpMethod.POST,
                new HttpEntity<>(body, headers),
                JSON_MAP);
        Map<String, Object> result = response.getBody();
        return result != null ? result : Map.of();
    }

    private TokenGrant toGrant(Map<String, Object> response) {
        String accessToken = (String) response.get("access_token");
        String refreshToken = (String) response.get("refresh_token");

        OffsetDateTime expiresAt = null;
        Object expiresIn = response.get("expires_in");
        if (expiresIn != null) {
            expiresAt = OffsetDateTime.now(clock).plusSeconds(Long.parseLong(expiresIn.toString()));
        }

        List<String> scopes = List.of();
        Object scope = response.get("scope");
        if (scope instanceof String s && !s.isBlank()) {
            scopes = Arrays.asList(s.trim().split("\\s+"));
        }

        return new TokenGrant(accessToken, refreshToken, expiresAt, scopes);
    }

    private TokenGrant exchangeCodeFallback(String code, String redirectUri, Throwable t) {
        if (t instanceof ConnectionException ce) {
            throw ce;
        }
        log.error("Google code exchange failed (circuit breaker): {}", t.getMessage());
        throw new OAuthTokenExchangeException("provider temporarily unavailable",
                ErrorMessageSanitizer.sanitize(t.getMessage()), t);
    }

    private TokenGrant refreshFallback(String refreshToken, Throwable t) {
        if (t instanceof ConnectionException ce) {
            throw ce;
        }
        log.error("Google token refresh failed (circuit breaker): {}", t.getMessage());
        throw new TokenRefreshException(null,
                "provider temporarily unavailable: " + ErrorMessageSanitizer.sanitize(t.getMessage()), t);
    }

    private ProviderIdentity fetchIdentityFallback(String accessToken, Throwable t) {
        if (t instanceof ConnectionException ce) {
            throw ce;
        }
        log.error("Google user info failed (circuit breaker): {}", t.getMessage());
        throw new IdentityFetchException("provider temporarily unavailable", t);
    }
}
