package com.yoursp.emailconnections.modules.connections;

import com.yoursp.emailconnections.config.EmailConnectionProperties;
import com.yoursp.emailconnections.exception.ConnectionException;
import com.yoursp.emailconnections.exception.ConnectionExpiredException;
import com.yoursp.emailconnections.exception.ConnectionHealthCheckException;
import com.yoursp.emailconnections.exception.ConnectionNotFoundException;
import com.yoursp.emailconnections.exception.ConnectionRevokedException;
import com.yoursp.emailconnections.exception.ErrorMessageSanitizer;
import com.yoursp.emailconnections.exception.TokenRefreshException;
import com.yoursp.emailconnections.exception.ValidationException;
import com.yoursp.emailconnections.model.ConnectionStatus;
import com.yoursp.emailconnections.model.entity.EmailConnection;
import com.yoursp.emailconnections.modules.connections.dto.ConnectionTokens;
import com.yoursp.emailconnections.modules.oauth.OAuthProviderClient;
import com.yoursp.emailconnections.modules.oauth.dto.ProviderIdentity;
import com.yoursp.emailconnections.modules.oauth.dto.TokenGrant;
import com.yoursp.emailconnections.modules.vault.TokenDecryptionException;
import com.yoursp.emailconnections.modules.vault.TokenVault;
import com.yoursp.emailconnections.repository.EmailConnectionRepository;
import com.yoursp.emailconnections.service.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read path for connection credentials and every write that changes them.
 * <p>
 * Token updates are compare-and-swap on the stored refresh ciphertext: a
 * refresh only commits if the row still holds the refresh token it was started
 * from. On a lost race the row is re-read; if the winner already left it fresh
 * those tokens are used, otherwise the refresh is retried once.
 * </p>
 */
@Slf4j
@Service
public class ConnectionTokenService {

    private static final int MAX_REFRESH_ATTEMPTS = 2;

    private final EmailConnectionRepository connectionRepository;
    private final TokenVault tokenVault;
    private final OAuthProviderClient providerClient;
    private final AuditService auditService;
    private final Clock clock;
    private final Duration refreshBuffer;

    public ConnectionTokenService(EmailConnectionRepository connectionRepository, TokenVault tokenVault,
            OAuthProviderClient providerClient, AuditService auditService, Clock clock,
            EmailConnectionProperties properties) {
        this.connectionRepository = connectionRepository;
        this.tokenVault = tokenVault;
        this.providerClient = providerClient;
        this.auditService = auditService;
        this.clock = clock;
        this.refreshBuffer = properties.getRefreshBuffer();
    }

    /**
     * Decrypted tokens for acting on the mailbox, refreshed first when they are
     * inside the refresh buffer.
     *
     * @return empty if the stored credentials cannot be decrypted (the connection
     *         is moved to error) or the connection is archived. If a refresh
     *         fails the previously stored tokens are returned and the connection
     *         is moved to error.
     * @throws ConnectionNotFoundException if the connection does not exist or is
     *                                     not owned by the user
     * @throws ConnectionRevokedException  if access was revoked at the provider
     */
    public Optional<ConnectionTokens> getTokens(Long connectionId, Long userId, boolean autoRefresh) {
        EmailConnection connection = load(connectionId, userId);

        if (connection.isArchived() || connection.getStatus() == ConnectionStatus.ARCHIVED) {
            log.debug("Connection {} is archived, no tokens handed out", connectionId);
            return Optional.empty();
        }
        if (connection.getStatus() == ConnectionStatus.REVOKED) {
            throw new ConnectionRevokedException(connectionId, connection.getEmailAddress());
        }

        ConnectionTokens stored;
        try {
            stored = decryptTokens(connection);
        } catch (TokenDecryptionException e) {
            log.error("Stored tokens for connection {} could not be decrypted", connectionId);
            markError(connectionId, userId, "Stored credentials could not be decrypted, re-authorization required");
            return Optional.empty();
        }

        if (!autoRefresh || stored.refreshToken() == null || !needsRefresh(connection.getTokenExpiresAt())) {
            return Optional.of(stored);
        }

        try {
            return Optional.of(refreshWithRetry(connection));
        } catch (ConnectionException | TokenDecryptionException e) {
            log.warn("Auto-refresh failed for connection {}: {}", connectionId, e.getMessage());
            recordRefreshFailure(connection, "Token refresh failed: " + e.getMessage());
            return Optional.of(stored);
        }
    }

    /**
     * Refreshes now, regardless of expiry.
     *
     * @throws ConnectionExpiredException if there is no refresh token to use
     * @throws TokenRefreshException      if the provider rejects the refresh; the
     *                                    connection has been moved to error
     */
    public ConnectionTokens refresh(Long connectionId, Long userId) {
        EmailConnection connection = load(connectionId, userId);

        if (connection.isArchived() || connection.getStatus() == ConnectionStatus.ARCHIVED) {
            throw new ValidationException("connection", "archived connections cannot be refreshed",
                    connectionId.toString());
        }
        if (connection.getStatus() == ConnectionStatus.REVOKED) {
            throw new ConnectionRevokedException(connectionId, connection.getEmailAddress());
        }
        if (!connection.hasRefreshToken()) {
            throw new ConnectionExpiredException(connectionId, connection.getEmailAddress());
        }

        try {
            return refreshWithRetry(connection);
        } catch (TokenRefreshException e) {
            recordRefreshFailure(connection, "Token refresh failed: " + e.getMessage());
            throw e;
        } catch (TokenDecryptionException e) {
            recordRefreshFailure(connection, "Stored credentials could not be decrypted, re-authorization required");
            throw new TokenRefreshException(connectionId, "stored refresh token is unreadable", e);
        }
    }

    /**
     * Proves the credential works by fetching the account identity. Success moves
     * the connection to active and stamps {@code last_sync_at}; failure moves it
     * to error.
     *
     * @throws ConnectionHealthCheckException if the identity call fails or there
     *                                        are no usable tokens
     */
    public ProviderIdentity verifyAccess(Long connectionId, Long userId) {
        ConnectionTokens tokens = getTokens(connectionId, userId, true)
                .orElseThrow(() -> new ConnectionHealthCheckException(connectionId,
                        "stored credentials are unusable", null));

        ProviderIdentity identity;
        try {
            identity = providerClient.fetchIdentity(tokens.accessToken());
        } catch (ConnectionException e) {
            markError(connectionId, userId, "Connection validation failed: " + e.getMessage());
            throw new ConnectionHealthCheckException(connectionId, e.getMessage(), e);
        }

        connectionRepository.markHealthy(connectionId, ConnectionStatus.ACTIVE, ConnectionStatus.REFRESHABLE,
                OffsetDateTime.now(clock));
        log.debug("Connection {} validation successful", connectionId);
        return identity;
    }

    /**
     * Moves a live connection to error with a sanitized message. Revoked and
     * archived connections are left untouched.
     *
     * @return true if the status was written
     */
    public boolean markError(Long connectionId, Long userId, String message) {
        load(connectionId, userId);
        String sanitized = ErrorMessageSanitizer.sanitize(message);

        int updated = connectionRepository.markStatus(connectionId, ConnectionStatus.ERROR, sanitized,
                ConnectionStatus.REFRESHABLE, OffsetDateTime.now(clock));
        if (updated == 0) {
            log.debug("Connection {} not marked as error (archived or terminal)", connectionId);
            return false;
        }

        log.warn("Connection {} marked as error: {}", connectionId, sanitized);
        auditService.log(userId, "CONNECTION_ERROR", connectionId, Map.of("error", sanitized));
        return true;
    }

    public boolean needsRefresh(OffsetDateTime expiresAt) {
        if (expiresAt == null) {
            return true;
        }
        return !OffsetDateTime.now(clock).plus(refreshBuffer).isBefore(expiresAt);
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private EmailConnection load(Long connectionId, Long userId) {
        return connectionRepository.findByIdAndUserId(connectionId, userId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId, userId));
    }

    private ConnectionTokens refreshWithRetry(EmailConnection snapshot) {
        Long connectionId = snapshot.getId();
        EmailConnection current = snapshot;

        for (int attempt = 1; attempt <= MAX_REFRESH_ATTEMPTS; attempt++) {
            String refreshToken = tokenVault.decrypt(current.getRefreshTokenEncrypted());
            TokenGrant grant = providerClient.refresh(refreshToken);

            // Refresh tokens do not always rotate
            String newRefreshToken = grant.refreshToken() != null && !grant.refreshToken().isEmpty()
                    ? grant.refreshToken()
                    : refreshToken;

            int updated = connectionRepository.swapTokens(
                    connectionId,
                    current.getRefreshTokenEncrypted(),
                    tokenVault.encrypt(grant.accessToken()),
                    tokenVault.encrypt(newRefreshToken),
                    grant.expiresAt(),
                    ConnectionStatus.ACTIVE,
                    ConnectionStatus.REFRESHABLE,
                    OffsetDateTime.now(clock));

            if (updated == 1) {
                log.info("Refreshed tokens for connection {} (expiresAt={})", connectionId, grant.expiresAt());
                auditService.log(current.getUserId(), "TOKEN_REFRESHED", connectionId, Map.of(
                        "previousStatus", current.getStatus().getValue(),
                        "expiresAt", String.valueOf(grant.expiresAt())));
                return new ConnectionTokens(grant.accessToken(), newRefreshToken, grant.expiresAt(),
                        scopesOf(current));
            }

            EmailConnection latest = connectionRepository.findById(connectionId)
                    .orElseThrow(() -> new ConnectionNotFoundException(connectionId, snapshot.getUserId()));
            if (latest.isArchived() || latest.getStatus().isTerminal() || !latest.hasRefreshToken()) {
                throw new TokenRefreshException(connectionId, "connection is no longer refreshable");
            }
            if (latest.getStatus() == ConnectionStatus.ACTIVE && !needsRefresh(latest.getTokenExpiresAt())) {
                log.debug("Connection {} was refreshed concurrently, using persisted tokens", connectionId);
                return decryptTokens(latest);
            }
            log.debug("Token swap for connection {} lost a race (attempt {})", connectionId, attempt);
            current = latest;
        }

        throw new TokenRefreshException(connectionId, "tokens changed concurrently, retry exhausted");
    }

    private void recordRefreshFailure(EmailConnection snapshot, String message) {
        String sanitized = ErrorMessageSanitizer.sanitize(message);
        int updated = connectionRepository.markStatusIfRefreshUnchanged(
                snapshot.getId(),
                snapshot.getRefreshTokenEncrypted(),
                ConnectionStatus.ERROR,
                sanitized,
                ConnectionStatus.REFRESHABLE,
                OffsetDateTime.now(clock));

        if (updated == 0) {
            log.debug("Connection {} changed concurrently, refresh failure not recorded", snapshot.getId());
            return;
        }
        log.warn("Connection {} marked as error: {}", snapshot.getId(), sanitized);
        auditService.log(snapshot.getUserId(), "CONNECTION_ERROR", snapshot.getId(), Map.of("error", sanitized));
    }

    private ConnectionTokens decryptTokens(EmailConnection connection) {
        String accessToken = tokenVault.decrypt(connection.getAccessTokenEncrypted());
        String refreshToken = tokenVault.decrypt(connection.getRefreshTokenEncrypted());
        return new ConnectionTokens(
                accessToken,
                refreshToken.isEmpty() ? null : refreshToken,
                connection.getTokenExpiresAt(),
                scopesOf(connection));
    }

    private static List<String> scopesOf(EmailConnection connection) {
        return connection.getScopesGranted() != null ? List.copyOf(connection.getScopesGranted()) : List.of();
    }
}
