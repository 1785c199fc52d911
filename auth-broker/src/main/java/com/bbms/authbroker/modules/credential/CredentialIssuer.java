package com.bbms.authbroker.modules.credential;

import com.bbms.authbroker.config.CredentialProperties;
import com.bbms.authbroker.model.entity.UserSession;
import com.bbms.authbroker.modules.credential.dto.IssuedCredential;
import com.bbms.authbroker.repository.UserSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * Mints and manages session credentials for biometric logins.
 * <p>
 * Tokens are opaque random strings backed by a {@code user_sessions} row.
 * One operation mints at most one credential.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@SuppressWarnings("null")
public class CredentialIssuer {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final UserSessionRepository sessionRepository;
    private final CredentialProperties properties;
    private final Clock clock;

    /**
     * Mint the credential for a verified authentication. Calling it again for
     * the same operation returns the credential already minted.
     */
    @Transactional
    public IssuedCredential issueCredential(UUID userId, String operationId) {
        Optional<UserSession> existing = sessionRepository.findByOperationId(operationId);
        if (existing.isPresent()) {
            log.warn("Credential already issued for operationId={}, not minting another", operationId);
            return IssuedCredential.from(existing.get());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = UserSession.builder()
                .userId(userId)
                .operationId(operationId)
                .accessToken(generateToken())
                .refreshToken(generateToken())
                .accessExpiresAt(now.plus(properties.getAccessTokenTtl()))
                .refreshExpiresAt(now.plus(properties.getRefreshTokenTtl()))
                .createdAt(now)
                .lastActive(now)
                .build();
        sessionRepository.save(session);

        log.info("Credential issued: userId={}, operationId={}, accessExpiresAt={}",
                userId, operationId, session.getAccessExpiresAt());
        return IssuedCredential.from(session);
    }

    /**
     * Hand out the credential of an operation. Only the first caller gets it.
     */
    @Transactional
    public Optional<IssuedCredential> claim(String operationId) {
        if (sessionRepository.markDelivered(operationId, OffsetDateTime.now(clock)) == 0) {
            return Optional.empty();
        }
        return sessionRepository.findByOperationId(operationId).map(IssuedCredential::from);
    }

    /**
     * Resolve a live session from its access token.
     *
     * @throws InvalidCredentialException when the token is unknown or expired
     */
    public UserSession authenticate(String accessToken) {
        UserSession session = sessionRepository.findByAccessToken(accessToken)
                .orElseThrow(() -> new InvalidCredentialException("Invalid access token"));
        if (isPast(session.getAccessExpiresAt())) {
            throw new InvalidCredentialException("Access token expired");
        }
        return session;
    }

    /**
     * Rotate both tokens of a session.
     *
     * @throws InvalidCredentialException when the refresh token is unknown or expired
     */
    @Transactional
    public IssuedCredential refresh(String refreshToken) {
        UserSession session = sessionRepository.findByRefreshToken(refreshToken)
                .orElseThrow(() -> new InvalidCredentialException("Invalid refresh token"));
        if (isPast(session.getRefreshExpiresAt())) {
            sessionRepository.delete(session);
            throw new InvalidCredentialException("Refresh token expired");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        session.setAccessToken(generateToken());
        session.setRefreshToken(generateToken());
        session.setAccessExpiresAt(now.plus(properties.getAccessTokenTtl()));
        session.setRefreshExpiresAt(now.plus(properties.getRefreshTokenTtl()));
        session.setLastActive(now);
        sessionRepository.save(session);

        log.info("Credential refreshed: userId={}, sessionId={}", session.getUserId(), session.getId());
        return IssuedCredential.from(session);
    }

    /**
     * Delete the session behind an access token. Unknown tokens are ignored.
     */
    @Transactional
    public void revoke(String accessToken) {
        sessionRepository.findByAccessToken(accessToken).ifPresent(session -> {
            sessionRepository.delete(session);
            log.info("Session revoked: userId={}, sessionId={}", session.getUserId(), session.getId());
        });
    }

    private boolean isPast(OffsetDateTime instant) {
        return instant != null && !instant.isAfter(OffsetDateTime.now(clock));
    }

    private String generateToken() {
        byte[] bytes = new byte[48];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
