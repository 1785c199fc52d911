package com.bbms.authbroker.modules.credential.dto;

import com.bbms.authbroker.model.entity.UserSession;

import java.time.OffsetDateTime;

public record IssuedCredential(
        String accessToken,
        String refreshToken,
        String tokenType,
        OffsetDateTime accessExpiresAt,
        OffsetDateTime refreshExpiresAt) {

    public static IssuedCredential from(UserSession session) {
        return new IssuedCredential(session.getAccessToken(), session.getRefreshToken(), "Bearer",
                session.getAccessExpiresAt(), session.getRefreshExpiresAt());
    }
}
