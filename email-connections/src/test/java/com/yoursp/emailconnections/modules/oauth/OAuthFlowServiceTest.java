package com.yoursp.emailconnections.modules.oauth;

import com.yoursp.emailconnections.config.EmailConnectionProperties;
import com.yoursp.emailconnections.exception.ConnectionAlreadyExistsException;
import com.yoursp.emailconnections.exception.InvalidOAuthStateException;
import com.yoursp.emailconnections.exception.OAuthTokenExchangeException;
import com.yoursp.emailconnections.exception.ValidationException;
import com.yoursp.emailconnections.model.ConnectionStatus;
import com.yoursp.emailconnections.model.entity.EmailConnection;
import com.yoursp.emailconnections.modules.connections.ConnectionService;
import com.yoursp.emailconnections.modules.connections.ConnectionTokenService;
import com.yoursp.emailconnections.modules.connections.ConnectionUsageProvider;
import com.yoursp.emailconnections.modules.connections.dto.ConnectionResponse;
import com.yoursp.emailconnections.modules.oauth.dto.OAuthInitiateResponse;
import com.yoursp.emailconnections.modules.oauth.dto.ProviderIdentity;
import com.yoursp.emailconnections.modules.oauth.dto.TokenGrant;
import com.yoursp.emailconnections.modules.vault.TokenVault;
import com.yoursp.emailconnections.repository.EmailConnectionRepository;
import com.yoursp.emailconnections.service.AuditService;
import com.yoursp.emailconnections.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Full authorization-code flow against the in-memory state store, a real
 * {@link TokenVault} and a stubbed Google client.
 */
@ExtendWith(MockitoExtension.class)
class OAuthFlowServiceTest {

    private static final String REDIRECT = "https://app/cb";

    @Mock
    private OAuthProviderClient providerClient;

    @Mock
    private EmailConnectionRepository connectionRepository;

    @Mock
    private ConnectionTokenService tokenService;

    @Mock
    private ObjectProvider<ConnectionUsageProvider> usageProviders;

    @Mock
    private AuditService auditService;

    private MutableClock clock;
    private TokenVault tokenVault;
    private InMemoryOAuthStateStore stateStore;
    private OAuthFlowService flowService;

    @BeforeEach
    void setUp() {
        EmailConnectionProperties properties = new EmailConnectionProperties();
        properties.setEncryptionSecret("test-encryption-secret");

        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        tokenVault = new TokenVault(properties);
        stateStore = new InMemoryOAuthStateStore(properties, clock);
        ConnectionService connectionService = new ConnectionService(connectionRepository, tokenService, tokenVault,
                providerClient, usageProviders, auditService, clock, properties);
        flowService = new OAuthFlowService(stateStore, providerClient, connectionService, properties);
    }

    @Test
    @DisplayName("initiate + callback stores an active connection with encrypted tokens and consumes the state")
    void fullFlowCreatesConnection() {
        when(providerClient.provider()).thenReturn("gmail");
        when(providerClient.authorizationUrl(eq(REDIRECT), isNull(), anyString()))
                .thenReturn("https://accounts.google.com/o/oauth2/v2/auth?state=x");
        stubSuccessfulExchange();
        when(connectionRepository.findLiveConnection(1L, "u@x.com", "gmail")).thenReturn(Optional.empty());
        when(connectionRepository.saveAndFlush(any(EmailConnection.class))).thenAnswer(invocation -> {
            EmailConnection entity = invocation.getArgument(0);
            entity.setId(42L);
            return entity;
        });

        OAuthInitiateResponse initiated = flowService.initiateAuthorization(1L, REDIRECT, null);
        ConnectionResponse connection = flowService.completeAuthorization(initiated.state(), "c1", null, null);

        assertEquals("gmail", initiated.provider());
        assertEquals(42L, connection.id());
        assertEquals(ConnectionStatus.ACTIVE, connection.connectionStatus());
        assertEquals("u@x.com", connection.emailAddress());

        ArgumentCaptor<EmailConnection> saved = ArgumentCaptor.forClass(EmailConnection.class);
        verify(connectionRepository).saveAndFlush(saved.capture());
        assertEquals(1L, saved.getValue().getUserId());
        assertEquals("A", tokenVault.decrypt(saved.getValue().getAccessTokenEncrypted()));
        assertEquals("R", tokenVault.decrypt(saved.getValue().getRefreshTokenEncrypted()));
        assertEquals("p1", saved.getValue().getProviderAccountId());

        assertTrue(stateStore.validateAndPeek(initiated.state()).isEmpty());
    }

    @Test
    @DisplayName("Replaying a completed callback is rejected before any token exchange")
    void replayedStateIsRejected() {
        String state = stateStore.generate(1L, REDIRECT);
        assertTrue(stateStore.consume(state));

        assertThrows(InvalidOAuthStateException.class,
                () -> flowService.completeAuthorization(state, "c1", null, null));
        verify(providerClient, never()).exchangeCode(any(), any());
    }

    @Test
    void unknownStateIsRejected() {
        assertThrows(InvalidOAuthStateException.class,
                () -> flowService.completeAuthorization("forged", "c1", null, null));
        verifyNoInteractions(providerClient);
    }

    @Test
    @DisplayName("State older than the TTL is rejected")
    void expiredStateIsRejected() {
        String state = stateStore.generate(1L, REDIRECT);
        clock.advance(Duration.ofMinutes(11));

        assertThrows(InvalidOAuthStateException.class,
                () -> flowService.completeAuthorization(state, "c1", null, null));
    }

    @Test
    @DisplayName("A failed code exchange leaves the state usable for a retry")
    void failedExchangeKeepsState() {
        String state = stateStore.generate(1L, REDIRECT);
        when(providerClient.exchangeCode("c1", REDIRECT))
                .thenThrow(new OAuthTokenExchangeException("provider rejected the authorization code", "invalid_grant"));

        assertThrows(OAuthTokenExchangeException.class,
                () -> flowService.completeAuthorization(state, "c1", null, null));
        assertTrue(stateStore.validateAndPeek(state).isPresent());
        verifyNoInteractions(connectionRepository);
    }

    @Test
    @DisplayName("A provider-reported error consumes the state")
    void providerErrorConsumesState() {
        String state = stateStore.generate(1L, REDIRECT);

        OAuthTokenExchangeException ex = assertThrows(OAuthTokenExchangeException.class,
                () -> flowService.completeAuthorization(state, null, null, "access_denied"));

        assertEquals("OAUTH_TOKEN_FAILED", ex.getErrorCode());
        assertTrue(stateStore.validateAndPeek(state).isEmpty());
        verifyNoInteractions(providerClient);
    }

    @Test
    void missingCodeIsRejected() {
        String state = stateStore.generate(1L, REDIRECT);

        assertThrows(ValidationException.class, () -> flowService.completeAuthorization(state, " ", null, null));
        assertTrue(stateStore.validateAndPeek(state).isPresent());
    }

    @Test
    @DisplayName("Second callback for an already connected account is rejected")
    void duplicateAccountIsRejected() {
        String state = stateStore.generate(1L, REDIRECT);
        when(providerClient.provider()).thenReturn("gmail");
        stubSuccessfulExchange();
        EmailConnection existing = EmailConnection.builder().id(5L).userId(1L).emailAddress("u@x.com")
                .provider("gmail").status(ConnectionStatus.ACTIVE).build();
        when(connectionRepository.findLiveConnection(1L, "u@x.com", "gmail")).thenReturn(Optional.of(existing));

        assertThrows(ConnectionAlreadyExistsException.class,
                () -> flowService.completeAuthorization(state, "c1", null, null));
        verify(connectionRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Callback scopes are stored when the token response lists none")
    void callbackScopesAreUsed() {
        String state = stateStore.generate(1L, REDIRECT);
        when(providerClient.provider()).thenReturn("gmail");
        stubSuccessfulExchange();
        when(connectionRepository.findLiveConnection(1L, "u@x.com", "gmail")).thenReturn(Optional.empty());
        when(connectionRepository.saveAndFlush(any(EmailConnection.class))).thenAnswer(i -> i.getArgument(0));

        ConnectionResponse connection = flowService.completeAuthorization(state, "c1", "scope-a scope-b", null);

        assertEquals(List.of("scope-a", "scope-b"), connection.scopesGranted());
    }

    @Test
    void initiateWithoutRedirectOrDefaultIsRejected() {
        assertThrows(ValidationException.class, () -> flowService.initiateAuthorization(1L, null, null));
    }

    private void stubSuccessfulExchange() {
        when(providerClient.exchangeCode("c1", REDIRECT)).thenReturn(new TokenGrant("A", "R",
                OffsetDateTime.now(clock).plusHours(1), List.of()));
        when(providerClient.fetchIdentity("A"))
                .thenReturn(new ProviderIdentity("p1", "u@x.com", true, null, null, null, null, null, null));
    }
}
