package com.yoursp.emailconnections.model.entity;

import com.yoursp.emailconnections.model.ConnectionStatus;
import com.yoursp.emailconnections.modules.oauth.dto.ProviderIdentity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A user's authorization to act on one external mailbox.
 * <p>
 * Tokens are only ever held encrypted here; see
 * {@code com.yoursp.emailconnections.modules.vault.TokenVault}. At most one
 * non-archived row exists per (user, email, provider).
 * </p>
 */
@Entity
@Table(name = "email_connections")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmailConnection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "email_address", nullable = false)
    private String emailAddress;

    @Column(name = "provider", length = 50, nullable = false)
    private String provider;

    @Column(name = "provider_account_id")
    private String providerAccountId;

    @Column(name = "connection_name")
    private String connectionName;

    @Column(name = "access_token_encrypted", columnDefinition = "TEXT")
    private String accessTokenEncrypted;

    @Column(name = "refresh_token_encrypted", columnDefinition = "TEXT")
    private String refreshTokenEncrypted;

    @Column(name = "token_expires_at")
    private OffsetDateTime tokenExpiresAt;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "scopes_granted", columnDefinition = "JSONB")
    private List<String> scopesGranted = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "oauth_data", columnDefinition = "JSONB")
    private ProviderIdentity oauthData;

    @Builder.Default
    @Column(name = "connection_status", length = 20, nullable = false)
    private ConnectionStatus status = ConnectionStatus.ACTIVE;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "last_sync_at")
    private OffsetDateTime lastSyncAt;

    @Builder.Default
    @Column(name = "is_archived", nullable = false)
    private boolean archived = false;

    @Column(name = "archived_at")
    private OffsetDateTime archivedAt;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    /** Timestamps come from the service clock; only the status is defaulted here. */
    @PrePersist
    protected void onCreate() {
        if (status == null)
            status = ConnectionStatus.ACTIVE;
    }

    public boolean hasRefreshToken() {
        return refreshTokenEncrypted != null && !refreshTokenEncrypted.isEmpty();
    }
}
