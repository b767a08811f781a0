package com.yoursp.emailconnections.modules.connections;

import com.yoursp.emailconnections.config.EmailConnectionProperties;
import com.yoursp.emailconnections.exception.ConnectionAlreadyExistsException;
import com.yoursp.emailconnections.exception.ConnectionNotFoundException;
import com.yoursp.emailconnections.exception.ValidationException;
import com.yoursp.emailconnections.model.ConnectionStatus;
import com.yoursp.emailconnections.model.entity.EmailConnection;
import com.yoursp.emailconnections.modules.connections.dto.*;
import com.yoursp.emailconnections.modules.oauth.OAuthProviderClient;
import com.yoursp.emailconnections.modules.oauth.dto.ProviderIdentity;
import com.yoursp.emailconnections.modules.vault.TokenDecryptionException;
import com.yoursp.emailconnections.modules.vault.TokenVault;
import com.yoursp.emailconnections.repository.EmailConnectionRepository;
import com.yoursp.emailconnections.service.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ownership-scoped lifecycle operations on email connections. Every lookup is
 * by (id, user id); another user's row is indistinguishable from a missing one.
 */
@Slf4j
@Service
public class ConnectionService {

    private static final Set<String> MAIL_READ_SCOPES = Set.of(
            "https://www.googleapis.com/auth/gmail.readonly",
            "https://www.googleapis.com/auth/gmail.modify",
            "https://mail.google.com/");

    private final EmailConnectionRepository connectionRepository;
    private final ConnectionTokenService tokenService;
    private final TokenVault tokenVault;
    private final OAuthProviderClient providerClient;
    private final ObjectProvider<ConnectionUsageProvider> usageProviders;
    private final AuditService auditService;
    private final Clock clock;
    private final Duration refreshBuffer;

    public ConnectionService(EmailConnectionRepository connectionRepository, ConnectionTokenService tokenService,
            TokenVault tokenVault, OAuthProviderClient providerClient,
            ObjectProvider<ConnectionUsageProvider> usageProviders, AuditService auditService, Clock clock,
            EmailConnectionProperties properties) {
        this.connectionRepository = connectionRepository;
        this.tokenService = tokenService;
        this.tokenVault = tokenVault;
        this.providerClient = providerClient;
        this.usageProviders = usageProviders;
        this.auditService = auditService;
        this.clock = clock;
        this.refreshBuffer = properties.getRefreshBuffer();
    }

    /**
     * Persists a freshly authorized connection as active.
     *
     * @throws ConnectionAlreadyExistsException if a non-archived connection for
     *                                          the same user, email and provider
     *                                          exists
     */
    public ConnectionResponse create(NewConnection request) {
        ProviderIdentity identity = request.identity();
        String email = identity.email();
        OffsetDateTime now = OffsetDateTime.now(clock);

        connectionRepository.findLiveConnection(request.userId(), email, request.provider())
                .ifPresent(existing -> {
                    throw new ConnectionAlreadyExistsException(email, existing.getId());
                });

        EmailConnection connection = EmailConnection.builder()
                .userId(request.userId())
                .provider(request.provider())
                .emailAddress(email)
                .providerAccountId(identity.id() != null ? identity.id() : email)
                .connectionName(identity.name() != null && !identity.name().isBlank() ? identity.name() : email)
                .accessTokenEncrypted(tokenVault.encrypt(request.accessToken()))
                .refreshTokenEncrypted(tokenVault.encrypt(request.refreshToken()))
                .tokenExpiresAt(request.tokenExpiresAt())
                .scopesGranted(request.scopes() != null ? List.copyOf(request.scopes()) : List.of())
                .oauthData(identity)
                .status(ConnectionStatus.ACTIVE)
                .lastSyncAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();

        EmailConnection saved;
        try {
            saved = connectionRepository.saveAndFlush(connection);
        } catch (DataIntegrityViolationException e) {
            // Lost a race against a concurrent callback for the same account
            Long existingId = connectionRepository.findLiveConnection(request.userId(), email, request.provider())
                    .map(EmailConnection::getId)
                    .orElse(null);
            throw new ConnectionAlreadyExistsException(email, existingId);
        }

        log.info("Created {} connection {} for user {}", saved.getProvider(), saved.getId(), saved.getUserId());
        auditService.log(saved.getUserId(), "CONNECTION_CREATED", saved.getId(), Map.of(
                "provider", saved.getProvider(),
                "email", saved.getEmailAddress(),
                "hasRefreshToken", saved.hasRefreshToken()));
        return ConnectionResponse.from(saved);
    }

    public ConnectionListResponse list(Long userId, boolean includeArchived) {
        List<EmailConnection> rows = includeArchived
                ? connectionRepository.findByUserIdOrderByCreatedAtDesc(userId)
                : connectionRepository.findByUserIdAndArchivedFalseOrderByCreatedAtDesc(userId);

        List<ConnectionResponse> connections = rows.stream().map(ConnectionResponse::from).toList();
        return new ConnectionListResponse(
                connections,
                connections.size(),
                countByStatus(rows, ConnectionStatus.ACTIVE),
                countByStatus(rows, ConnectionStatus.EXPIRED),
                countByStatus(rows, ConnectionStatus.ERROR));
    }

    public ConnectionResponse get(Long connectionId, Long userId) {
        return ConnectionResponse.from(load(connectionId, userId));
    }

    /**
     * Renames a connection and/or sets its status. Setting {@code active} clears
     * the stored error message. Revoked and archived connections cannot be moved,
     * and {@code revoked} cannot be set by a caller.
     * <p>
     * Both edits are column-scoped conditional updates, so a refresh committed
     * between the read and the write is never reverted.
     */
    public ConnectionResponse update(Long connectionId, Long userId, ConnectionUpdateRequest request) {
        EmailConnection connection = load(connectionId, userId);
        Map<String, Object> changes = new LinkedHashMap<>();

        String name = null;
        if (request.getConnectionName() != null) {
            name = request.getConnectionName().trim();
            if (name.isEmpty()) {
                throw new ValidationException("connection_name", "must not be blank", request.getConnectionName());
            }
        }

        ConnectionStatus target = null;
        ConnectionStatus from = connection.isArchived() ? ConnectionStatus.ARCHIVED : connection.getStatus();
        if (request.getConnectionStatus() != null) {
            target = parseStatus(request.getConnectionStatus());
            if (target == ConnectionStatus.REVOKED || target == ConnectionStatus.ARCHIVED) {
                throw new ValidationException("connection_status",
                        "'" + target.getValue() + "' cannot be set directly", request.getConnectionStatus());
            }
            if (from != target && !from.canTransitionTo(target)) {
                throw new ValidationException("connection_status",
                        "cannot change from '" + from.getValue() + "' to '" + target.getValue() + "'",
                        request.getConnectionStatus());
            }
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (target != null) {
            int updated = target == ConnectionStatus.ACTIVE
                    ? connectionRepository.markStatus(connectionId, target, null, Set.of(from), now)
                    : connectionRepository.updateStatus(connectionId, target, Set.of(from), now);
            if (updated == 0) {
                throw new ValidationException("connection_status",
                        "status changed concurrently, reload and retry", request.getConnectionStatus());
            }
            changes.put("connectionStatus", target.getValue());
        }
        if (name != null) {
            connectionRepository.rename(connectionId, userId, name, now);
            changes.put("connectionName", name);
        }

        log.info("Updated connection {} for user {}: {}", connectionId, userId, changes.keySet());
        auditService.log(userId, "CONNECTION_UPDATED", connectionId, changes);
        return ConnectionResponse.from(load(connectionId, userId));
    }

    /**
     * Counts downstream records that depend on the connection.
     */
    public ConnectionUsage checkUsage(Long connectionId, Long userId) {
        load(connectionId, userId);

        Map<String, Long> related = new LinkedHashMap<>();
        usageProviders.orderedStream().forEach(provider -> {
            long count = provider.countRelated(connectionId);
            if (count > 0) {
                related.merge(provider.recordType(), count, Long::sum);
            }
        });

        long total = related.values().stream().mapToLong(Long::longValue).sum();
        return new ConnectionUsage(connectionId, related, total, total == 0);
    }

    /**
     * Hard-deletes the connection when nothing depends on it, archives it
     * otherwise. The provider token is then revoked best-effort; a failed
     * revocation never fails the delete.
     */
    public ConnectionDeleteResponse delete(Long connectionId, Long userId) {
        EmailConnection connection = load(connectionId, userId);
        ConnectionUsage usage = checkUsage(connectionId, userId);
        String tokenToRevoke = readTokenForRevocation(connection);

        boolean archived;
        String message;
        if (usage.canDelete()) {
            connectionRepository.delete(connection);
            archived = false;
            message = "Connection deleted";
            log.info("Deleted connection {} for user {}", connectionId, userId);
            auditService.log(userId, "CONNECTION_DELETED", connectionId, Map.of(
                    "email", connection.getEmailAddress()));
        } else {
            OffsetDateTime now = OffsetDateTime.now(clock);
            // A revoked row keeps its terminal status and is only hidden
            if (connectionRepository.archive(connectionId, ConnectionStatus.ARCHIVED,
                    ConnectionStatus.REFRESHABLE, now) == 0) {
                connectionRepository.archiveKeepingStatus(connectionId, now);
            }
            archived = true;
            message = "Connection archived due to " + usage.relatedCount() + " related records";
            log.info("Archived connection {} for user {} ({} related records)", connectionId, userId,
                    usage.relatedCount());
            auditService.log(userId, "CONNECTION_ARCHIVED", connectionId, Map.of(
                    "email", connection.getEmailAddress(),
                    "relatedRecords", usage.relatedCount()));
        }

        boolean revoked = tokenToRevoke != null && providerClient.revoke(tokenToRevoke);
        if (tokenToRevoke != null && !revoked) {
            log.warn("Provider revocation failed for connection {}, local {} stands", connectionId,
                    archived ? "archive" : "delete");
        }

        return new ConnectionDeleteResponse(connectionId, connection.getEmailAddress(), archived, revoked, message);
    }

    /**
     * Health derived from the stored status and token expiry. Makes no provider
     * call.
     */
    public ConnectionHealthReport checkHealth(Long connectionId, Long userId) {
        EmailConnection connection = load(connectionId, userId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = connection.getTokenExpiresAt();

        // Unknown expiry counts as expired
        boolean expired = expiresAt == null || !now.isBefore(expiresAt);
        boolean expiringSoon = expired || !now.plus(refreshBuffer).isBefore(expiresAt);
        boolean healthy = connection.getStatus() == ConnectionStatus.ACTIVE && !connection.isArchived() && !expired;
        boolean needsReauth = expiringSoon || connection.getStatus().isTerminal();

        return new ConnectionHealthReport(
                connectionId,
                healthy,
                connection.getStatus(),
                now,
                connection.getErrorMessage(),
                expiresAt,
                needsReauth);
    }

    /**
     * Dashboard aggregate over the user's non-archived connections, computed from
     * the stored status field.
     */
    public BulkConnectionStatus bulkStatus(Long userId) {
        List<EmailConnection> rows = connectionRepository.findByUserIdAndArchivedFalseOrderByCreatedAtDesc(userId);

        List<ConnectionStatusSummary> summaries = rows.stream()
                .map(c -> new ConnectionStatusSummary(c.getId(), c.getEmailAddress(), c.getStatus(),
                        c.getLastSyncAt(), c.getErrorMessage()))
                .toList();

        return new BulkConnectionStatus(
                rows.size(),
                countByStatus(rows, ConnectionStatus.ACTIVE),
                countByStatus(rows, ConnectionStatus.EXPIRED),
                countByStatus(rows, ConnectionStatus.ERROR),
                summaries);
    }

    public TokenRefreshResponse refreshNow(Long connectionId, Long userId) {
        ConnectionTokens tokens = tokenService.refresh(connectionId, userId);
        return new TokenRefreshResponse(connectionId, true, tokens.expiresAt(), "Tokens refreshed successfully");
    }

    /**
     * Calls the provider with the stored credential to prove it works.
     */
    public ConnectionTestResponse testConnection(Long connectionId, Long userId) {
        ProviderIdentity identity = tokenService.verifyAccess(connectionId, userId);
        EmailConnection connection = load(connectionId, userId);
        List<String> scopes = connection.getScopesGranted() != null ? connection.getScopesGranted() : List.of();

        return new ConnectionTestResponse(
                connectionId,
                true,
                identity.email(),
                List.copyOf(scopes),
                scopes.stream().anyMatch(MAIL_READ_SCOPES::contains),
                OffsetDateTime.now(clock));
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private EmailConnection load(Long connectionId, Long userId) {
        return connectionRepository.findByIdAndUserId(connectionId, userId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId, userId));
    }

    private String readTokenForRevocation(EmailConnection connection) {
        try {
            String accessToken = tokenVault.decrypt(connection.getAccessTokenEncrypted());
            return accessToken.isEmpty() ? null : accessToken;
        } catch (TokenDecryptionException e) {
            log.warn("Connection {} token unreadable, skipping provider revocation", connection.getId());
            return null;
        }
    }

    private static ConnectionStatus parseStatus(String value) {
        try {
            return ConnectionStatus.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("connection_status", "unknown status", value);
        }
    }

    private static long countByStatus(List<EmailConnection> rows, ConnectionStatus status) {
        return rows.stream().filter(c -> c.getStatus() == status).count();
    }
}
