package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.model.entity.User;
import com.bbms.authbroker.modules.credential.SessionAuthFilter;
import com.bbms.authbroker.modules.lifecycle.dto.UserProfileResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /auth/me: profile of the session user, with their enrollment state.
 */
@RestController
@RequiredArgsConstructor
public class ProfileController {

    private final EnrollmentQueryService enrollmentQueryService;

    @GetMapping("/auth/me")
    public ResponseEntity<UserProfileResponse> me(HttpServletRequest request) {
        User user = (User) request.getAttribute(SessionAuthFilter.CURRENT_USER_ATTRIBUTE);
        if (user == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(UserProfileResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .displayName(user.getDisplayName())
                .department(user.getDepartment())
                .role(user.getRole())
                .biometricEnrolled(enrollmentQueryService.isEnrolled(user.getId()))
                .createdAt(user.getCreatedAt())
                .lastLoginAt(user.getLastLoginAt())
                .build());
    }
}
