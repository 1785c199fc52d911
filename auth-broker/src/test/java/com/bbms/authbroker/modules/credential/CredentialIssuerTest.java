package com.bbms.authbroker.modules.credential;

import com.bbms.authbroker.config.CredentialProperties;
import com.bbms.authbroker.model.entity.UserSession;
import com.bbms.authbroker.modules.credential.dto.IssuedCredential;
import com.bbms.authbroker.repository.UserSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class CredentialIssuerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final OffsetDateTime NOW_ODT = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private UserSessionRepository sessionRepository;

    private CredentialIssuer issuer;

    @BeforeEach
    void setUp() {
        CredentialProperties properties = new CredentialProperties();
        properties.setAccessTokenTtl(Duration.ofMinutes(30));
        properties.setRefreshTokenTtl(Duration.ofDays(1));
        issuer = new CredentialIssuer(sessionRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("First issue mints a fresh session with configured lifetimes")
    void issueMintsSession() {
        UUID userId = UUID.randomUUID();
        when(sessionRepository.findByOperationId("tx-1")).thenReturn(Optional.empty());

        IssuedCredential credential = issuer.issueCredential(userId, "tx-1");

        ArgumentCaptor<UserSession> captor = ArgumentCaptor.forClass(UserSession.class);
        verify(sessionRepository).save(captor.capture());
        UserSession saved = captor.getValue();
        assertEquals(userId, saved.getUserId());
        assertEquals("tx-1", saved.getOperationId());
        assertEquals(NOW_ODT.plusMinutes(30), credential.accessExpiresAt());
        assertEquals(NOW_ODT.plusDays(1), credential.refreshExpiresAt());
        assertEquals("Bearer", credential.tokenType());
        assertNotEquals(credential.accessToken(), credential.refreshToken());
        assertEquals(64, credential.accessToken().length());
    }

    @Test
    @DisplayName("Second issue for the same operation returns the existing credential")
    void issueIsIdempotentPerOperation() {
        UserSession existing = UserSession.builder()
                .operationId("tx-1").accessToken("a-token").refreshToken("r-token").build();
        when(sessionRepository.findByOperationId("tx-1")).thenReturn(Optional.of(existing));

        IssuedCredential credential = issuer.issueCredential(UUID.randomUUID(), "tx-1");

        assertEquals("a-token", credential.accessToken());
        verify(sessionRepository, never()).save(any());
    }

    @Test
    @DisplayName("Claim hands the credential to the first caller only")
    void claimOnce() {
        UserSession session = UserSession.builder()
                .operationId("tx-1").accessToken("a-token").refreshToken("r-token").build();
        when(sessionRepository.markDelivered(eq("tx-1"), any())).thenReturn(1, 0);
        when(sessionRepository.findByOperationId("tx-1")).thenReturn(Optional.of(session));

        assertTrue(issuer.claim("tx-1").isPresent());
        assertTrue(issuer.claim("tx-1").isEmpty());
        verify(sessionRepository, times(1)).findByOperationId("tx-1");
    }

    @Test
    @DisplayName("Authenticate: unknown token and expired token are rejected")
    void authenticateRejectsInvalid() {
        when(sessionRepository.findByAccessToken("unknown")).thenReturn(Optional.empty());
        when(sessionRepository.findByAccessToken("stale")).thenReturn(Optional.of(
                UserSession.builder().accessToken("stale").accessExpiresAt(NOW_ODT).build()));

        assertThrows(InvalidCredentialException.class, () -> issuer.authenticate("unknown"));
        assertThrows(InvalidCredentialException.class, () -> issuer.authenticate("stale"));
    }

    @Test
    @DisplayName("Authenticate: live token resolves its session")
    void authenticateLive() {
        UserSession session = UserSession.builder()
                .accessToken("live").accessExpiresAt(NOW_ODT.plusMinutes(1)).build();
        when(sessionRepository.findByAccessToken("live")).thenReturn(Optional.of(session));

        assertSame(session, issuer.authenticate("live"));
    }

    @Test
    @DisplayName("Refresh rotates both tokens")
    void refreshRotates() {
        UserSession session = UserSession.builder()
                .accessToken("old-a").refreshToken("old-r")
                .refreshExpiresAt(NOW_ODT.plusHours(1)).build();
        when(sessionRepository.findByRefreshToken("old-r")).thenReturn(Optional.of(session));

        IssuedCredential credential = issuer.refresh("old-r");

        assertNotEquals("old-a", credential.accessToken());
        assertNotEquals("old-r", credential.refreshToken());
        assertEquals(NOW_ODT.plusMinutes(30), session.getAccessExpiresAt());
        verify(sessionRepository).save(session);
    }

    @Test
    @DisplayName("Refresh with expired refresh token deletes the session")
    void refreshExpired() {
        UserSession session = UserSession.builder()
                .refreshToken("old-r").refreshExpiresAt(NOW_ODT.minusSeconds(1)).build();
        when(sessionRepository.findByRefreshToken("old-r")).thenReturn(Optional.of(session));

        assertThrows(InvalidCredentialException.class, () -> issuer.refresh("old-r"));
        verify(sessionRepository).delete(session);
    }

    @Test
    @DisplayName("Revoke of unknown token is a no-op")
    void revokeUnknown() {
        when(sessionRepository.findByAccessToken("nope")).thenReturn(Optional.empty());

        issuer.revoke("nope");

        verify(sessionRepository, never()).delete(any());
    }
}
