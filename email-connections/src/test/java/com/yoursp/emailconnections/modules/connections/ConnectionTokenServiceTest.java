package com.yoursp.emailconnections.modules.connections;

import com.yoursp.emailconnections.config.EmailConnectionProperties;
import com.yoursp.emailconnections.exception.ConnectionExpiredException;
import com.yoursp.emailconnections.exception.ConnectionHealthCheckException;
import com.yoursp.emailconnections.exception.ConnectionNotFoundException;
import com.yoursp.emailconnections.exception.ConnectionRevokedException;
import com.yoursp.emailconnections.exception.IdentityFetchException;
import com.yoursp.emailconnections.exception.TokenRefreshException;
import com.yoursp.emailconnections.model.ConnectionStatus;
import com.yoursp.emailconnections.model.entity.EmailConnection;
import com.yoursp.emailconnections.modules.connections.dto.ConnectionTokens;
import com.yoursp.emailconnections.modules.oauth.OAuthProviderClient;
import com.yoursp.emailconnections.modules.oauth.dto.ProviderIdentity;
import com.yoursp.emailconnections.modules.oauth.dto.TokenGrant;
import com.yoursp.emailconnections.modules.vault.TokenVault;
import com.yoursp.emailconnections.repository.EmailConnectionRepository;
import com.yoursp.emailconnections.service.AuditService;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConnectionTokenServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static TokenVault tokenVault;

    @Mock
    private EmailConnectionRepository connectionRepository;

    @Mock
    private OAuthProviderClient providerClient;

    @Mock
    private AuditService auditService;

    private ConnectionTokenService tokenService;

    @BeforeAll
    static void initVault() {
        EmailConnectionProperties properties = new EmailConnectionProperties();
        properties.setEncryptionSecret("test-encryption-secret");
        tokenVault = new TokenVault(properties);
    }

    @BeforeEach
    void setUp() {
        EmailConnectionProperties properties = new EmailConnectionProperties();
        tokenService = new ConnectionTokenService(connectionRepository, tokenVault, providerClient, auditService,
                CLOCK, properties);
    }

    // ================================================================
    // getTokens
    // ================================================================

    @Test
    @DisplayName("Token inside the refresh buffer is refreshed exactly once and persisted")
    void expiringTokenIsRefreshed() {
        EmailConnection connection = connection(ConnectionStatus.ACTIVE, "old-access", "refresh-1",
                now().plusMinutes(4));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));
        OffsetDateTime newExpiry = now().plusHours(1);
        when(providerClient.refresh("refresh-1"))
                .thenReturn(new TokenGrant("new-access", null, newExpiry, List.of()));
        when(connectionRepository.swapTokens(eq(7L), eq(connection.getRefreshTokenEncrypted()), anyString(),
                anyString(), eq(newExpiry), eq(ConnectionStatus.ACTIVE), anyCollection(), eq(now())))
                .thenReturn(1);

        Optional<ConnectionTokens> tokens = tokenService.getTokens(7L, 1L, true);

        assertTrue(tokens.isPresent());
        assertEquals("new-access", tokens.get().accessToken());
        assertEquals("refresh-1", tokens.get().refreshToken());
        assertEquals(newExpiry, tokens.get().expiresAt());
        verify(providerClient, times(1)).refresh("refresh-1");

        ArgumentCaptor<String> access = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> refresh = ArgumentCaptor.forClass(String.class);
        verify(connectionRepository).swapTokens(eq(7L), anyString(), access.capture(), refresh.capture(),
                eq(newExpiry), eq(ConnectionStatus.ACTIVE), anyCollection(), any());
        assertEquals("new-access", tokenVault.decrypt(access.getValue()));
        assertEquals("refresh-1", tokenVault.decrypt(refresh.getValue()));
        verify(auditService).log(eq(1L), eq("TOKEN_REFRESHED"), eq(7L), anyMap());
    }

    @Test
    void freshTokenIsReturnedWithoutProviderCall() {
        EmailConnection connection = connection(ConnectionStatus.ACTIVE, "access", "refresh",
                now().plusHours(1));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));

        ConnectionTokens tokens = tokenService.getTokens(7L, 1L, true).orElseThrow();

        assertEquals("access", tokens.accessToken());
        assertEquals("refresh", tokens.refreshToken());
        verifyNoInteractions(providerClient);
    }

    @Test
    @DisplayName("Refresh failure returns the stored tokens and moves the connection to error")
    void refreshFailureReturnsStaleTokens() {
        EmailConnection connection = connection(ConnectionStatus.ACTIVE, "old-access", "refresh-1",
                now().minusMinutes(1));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));
        when(providerClient.refresh("refresh-1")).thenThrow(new TokenRefreshException(null, "invalid_grant"));
        when(connectionRepository.markStatusIfRefreshUnchanged(eq(7L), eq(connection.getRefreshTokenEncrypted()),
                eq(ConnectionStatus.ERROR), anyString(), anyCollection(), any())).thenReturn(1);

        ConnectionTokens tokens = tokenService.getTokens(7L, 1L, true).orElseThrow();

        assertEquals("old-access", tokens.accessToken());
        verify(connectionRepository, never()).swapTokens(anyLong(), any(), any(), any(), any(), any(), any(),
                any());
        verify(auditService).log(eq(1L), eq("CONNECTION_ERROR"), eq(7L), anyMap());
    }

    @Test
    @DisplayName("Undecryptable credentials yield no tokens and an error status")
    void decryptFailureYieldsEmpty() {
        EmailConnection connection = connection(ConnectionStatus.ACTIVE, "access", "refresh",
                now().plusHours(1));
        connection.setAccessTokenEncrypted("bm90LWEtdmFsaWQtY2lwaGVydGV4dC1hdC1hbGw=");
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));
        when(connectionRepository.markStatus(eq(7L), eq(ConnectionStatus.ERROR), anyString(), anyCollection(),
                any())).thenReturn(1);

        Optional<ConnectionTokens> tokens = tokenService.getTokens(7L, 1L, true);

        assertTrue(tokens.isEmpty());
        verify(connectionRepository).markStatus(eq(7L), eq(ConnectionStatus.ERROR), anyString(), anyCollection(),
                any());
        verifyNoInteractions(providerClient);
    }

    @Test
    @DisplayName("Expired token without refresh token is returned as-is")
    void noRefreshTokenReturnsStale() {
        EmailConnection connection = connection(ConnectionStatus.EXPIRED, "stale-access", null,
                now().minusMinutes(10));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));

        ConnectionTokens tokens = tokenService.getTokens(7L, 1L, true).orElseThrow();

        assertEquals("stale-access", tokens.accessToken());
        assertNull(tokens.refreshToken());
        verifyNoInteractions(providerClient);
        verify(connectionRepository, never()).markStatus(anyLong(), any(), any(), any(), any());
    }

    @Test
    void autoRefreshDisabledSkipsRefresh() {
        EmailConnection connection = connection(ConnectionStatus.ACTIVE, "access", "refresh",
                now().minusMinutes(10));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));

        ConnectionTokens tokens = tokenService.getTokens(7L, 1L, false).orElseThrow();

        assertEquals("access", tokens.accessToken());
        verifyNoInteractions(providerClient);
    }

    @Test
    @DisplayName("Losing the swap to a concurrent refresh uses the winner's tokens")
    void lostRaceUsesPersistedTokens() {
        EmailConnection connection = connection(ConnectionStatus.ACTIVE, "old-access", "refresh-1",
                now().plusMinutes(2));
        EmailConnection winner = connection(ConnectionStatus.ACTIVE, "winner-access", "refresh-2",
                now().plusHours(1));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));
        when(providerClient.refresh("refresh-1"))
                .thenReturn(new TokenGrant("loser-access", null, now().plusHours(1), List.of()));
        when(connectionRepository.swapTokens(anyLong(), anyString(), anyString(), anyString(), any(), any(),
                anyCollection(), any())).thenReturn(0);
        when(connectionRepository.findById(7L)).thenReturn(Optional.of(winner));

        ConnectionTokens tokens = tokenService.getTokens(7L, 1L, true).orElseThrow();

        assertEquals("winner-access", tokens.accessToken());
        assertEquals("refresh-2", tokens.refreshToken());
        verify(providerClient, times(1)).refresh(anyString());
    }

    @Test
    void revokedConnectionThrows() {
        EmailConnection connection = connection(ConnectionStatus.REVOKED, "access", "refresh",
                now().plusHours(1));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));

        assertThrows(ConnectionRevokedException.class, () -> tokenService.getTokens(7L, 1L, true));
    }

    @Test
    void archivedConnectionYieldsEmpty() {
        EmailConnection connection = connection(ConnectionStatus.ARCHIVED, "access", "refresh",
                now().plusHours(1));
        connection.setArchived(true);
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));

        assertTrue(tokenService.getTokens(7L, 1L, true).isEmpty());
    }

    @Test
    @DisplayName("Another user's connection is reported as not found")
    void foreignConnectionIsNotFound() {
        when(connectionRepository.findByIdAndUserId(7L, 2L)).thenReturn(Optional.empty());

        assertThrows(ConnectionNotFoundException.class, () -> tokenService.getTokens(7L, 2L, true));
    }

    // ================================================================
    // refresh / verifyAccess / markError
    // ================================================================

    @Test
    void refreshWithoutRefreshTokenThrowsExpired() {
        EmailConnection connection = connection(ConnectionStatus.EXPIRED, "access", null, now().minusHours(1));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));

        assertThrows(ConnectionExpiredException.class, () -> tokenService.refresh(7L, 1L));
        verifyNoInteractions(providerClient);
    }

    @Test
    @DisplayName("Explicit refresh failure is recorded and rethrown")
    void refreshFailureIsRecordedAndRethrown() {
        EmailConnection connection = connection(ConnectionStatus.ACTIVE, "access", "refresh-1",
                now().plusHours(1));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));
        when(providerClient.refresh("refresh-1")).thenThrow(new TokenRefreshException(null, "invalid_grant"));
        when(connectionRepository.markStatusIfRefreshUnchanged(anyLong(), anyString(), any(), anyString(),
                anyCollection(), any())).thenReturn(1);

        assertThrows(TokenRefreshException.class, () -> tokenService.refresh(7L, 1L));
        verify(connectionRepository).markStatusIfRefreshUnchanged(eq(7L), anyString(),
                eq(ConnectionStatus.ERROR), contains("invalid_grant"), anyCollection(), any());
    }

    @Test
    @DisplayName("Successful identity fetch marks the connection healthy")
    void verifyAccessMarksHealthy() {
        EmailConnection connection = connection(ConnectionStatus.ACTIVE, "access", "refresh",
                now().plusHours(1));
        ProviderIdentity identity = new ProviderIdentity("p1", "u@x.com", true, null, null, null, null, null,
                null);
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));
        when(providerClient.fetchIdentity("access")).thenReturn(identity);
        when(connectionRepository.markHealthy(eq(7L), eq(ConnectionStatus.ACTIVE), anyCollection(), eq(now())))
                .thenReturn(1);

        assertEquals(identity, tokenService.verifyAccess(7L, 1L));
        verify(connectionRepository).markHealthy(eq(7L), eq(ConnectionStatus.ACTIVE), anyCollection(),
                eq(now()));
    }

    @Test
    void verifyAccessFailureMarksError() {
        EmailConnection connection = connection(ConnectionStatus.ACTIVE, "access", "refresh",
                now().plusHours(1));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));
        when(providerClient.fetchIdentity("access"))
                .thenThrow(new IdentityFetchException("401 Unauthorized", null));
        when(connectionRepository.markStatus(eq(7L), eq(ConnectionStatus.ERROR), anyString(), anyCollection(),
                any())).thenReturn(1);

        assertThrows(ConnectionHealthCheckException.class, () -> tokenService.verifyAccess(7L, 1L));
        verify(connectionRepository, never()).markHealthy(anyLong(), any(), any(), any());
    }

    @Test
    @DisplayName("Error messages are sanitized before they are stored")
    void markErrorSanitizes() {
        EmailConnection connection = connection(ConnectionStatus.ACTIVE, "access", "refresh",
                now().plusHours(1));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));
        when(connectionRepository.markStatus(anyLong(), any(), anyString(), anyCollection(), any()))
                .thenReturn(1);

        assertTrue(tokenService.markError(7L, 1L, "access_token=abc123 failed"));

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(connectionRepository).markStatus(eq(7L), eq(ConnectionStatus.ERROR), message.capture(),
                anyCollection(), any());
        assertFalse(message.getValue().contains("abc123"));
        assertTrue(message.getValue().contains("[REDACTED]"));
    }

    @Test
    void markErrorOnTerminalConnectionIsNoOp() {
        EmailConnection connection = connection(ConnectionStatus.REVOKED, "access", "refresh",
                now().plusHours(1));
        when(connectionRepository.findByIdAndUserId(7L, 1L)).thenReturn(Optional.of(connection));
        when(connectionRepository.markStatus(anyLong(), any(), anyString(), anyCollection(), any()))
                .thenReturn(0);

        assertFalse(tokenService.markError(7L, 1L, "boom"));
        verifyNoInteractions(auditService);
    }

    @Test
    void needsRefreshHonoursBuffer() {
        assertTrue(tokenService.needsRefresh(null));
        assertTrue(tokenService.needsRefresh(now().plusMinutes(5)));
        assertFalse(tokenService.needsRefresh(now().plusMinutes(6)));
    }

    // ================================================================
    // Helpers
    // ================================================================

    private static OffsetDateTime now() {
        return OffsetDateTime.now(CLOCK);
    }

    private static EmailConnection connection(ConnectionStatus status, String accessToken, String refreshToken,
            OffsetDateTime expiresAt) {
        return EmailConnection.builder()
                .id(7L)
                .userId(1L)
                .emailAddress("u@x.com")
                .provider("gmail")
                .accessTokenEncrypted(tokenVault.encrypt(accessToken))
                .refreshTokenEncrypted(tokenVault.encrypt(refreshToken))
                .tokenExpiresAt(expiresAt)
                .scopesGranted(List.of("https://www.googleapis.com/auth/gmail.readonly"))
                .status(status)
                .build();
    }
}
