package com.bbms.authbroker.modules.lifecycle.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserProfileResponse {
    private final UUID id;
    private final String email;
    private final String displayName;
    private final String department;
    private final String role;
    private final boolean biometricEnrolled;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime lastLoginAt;
}
