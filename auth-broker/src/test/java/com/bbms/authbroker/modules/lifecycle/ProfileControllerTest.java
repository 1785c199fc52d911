package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.model.entity.User;
import com.bbms.authbroker.modules.credential.SessionAuthFilter;
import com.bbms.authbroker.modules.lifecycle.dto.UserProfileResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProfileControllerTest {

    @Mock
    private EnrollmentQueryService enrollmentQueryService;
    @Mock
    private HttpServletRequest request;

    @InjectMocks
    private ProfileController controller;

    @Test
    @DisplayName("Session user → profile with enrollment flag")
    void profileOfSessionUser() {
        User user = User.builder().id(UUID.randomUUID()).email("ops@bbms.test").displayName("Ops")
                .department("Lab").role("technician").active(true)
                .createdAt(OffsetDateTime.parse("2026-01-01T00:00:00Z")).build();
        when(request.getAttribute(SessionAuthFilter.CURRENT_USER_ATTRIBUTE)).thenReturn(user);
        when(enrollmentQueryService.isEnrolled(user.getId())).thenReturn(true);

        ResponseEntity<UserProfileResponse> response = controller.me(request);

        assertEquals(200, response.getStatusCode().value());
        assertEquals(user.getId(), response.getBody().getId());
        assertEquals("ops@bbms.test", response.getBody().getEmail());
        assertEquals("technician", response.getBody().getRole());
        assertTrue(response.getBody().isBiometricEnrolled());
    }

    @Test
    @DisplayName("No session user → 401")
    void noSession() {
        when(request.getAttribute(SessionAuthFilter.CURRENT_USER_ATTRIBUTE)).thenReturn(null);

        assertEquals(401, controller.me(request).getStatusCode().value());
        verifyNoInteractions(enrollmentQueryService);
    }
}
