package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.model.entity.User;
import com.bbms.authbroker.modules.credential.SessionAuthFilter;
import com.bbms.authbroker.modules.lifecycle.dto.EnrollmentStatusResponse;
import com.bbms.authbroker.modules.lifecycle.dto.OperationStartResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Biometric enrollment for the session user.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /biometric/enroll: start enrollment, 409 when already enrolled</li>
 * <li>POST /biometric/re-enroll: start enrollment regardless</li>
 * <li>GET /biometric/enrollment/status: latest enrollment of the user</li>
 * <li>DELETE /biometric/data: delete the user's biometric data</li>
 * </ul>
 * Progress of a started enrollment is read from
 * {@code GET /biometric/operations/{operationId}}.
 */
@Slf4j
@RestController
@RequestMapping("/biometric")
@RequiredArgsConstructor
public class BiometricEnrollmentController {

    private final BiometricOperationService operationService;
    private final EnrollmentQueryService enrollmentQueryService;

    @PostMapping("/enroll")
    public ResponseEntity<?> enroll(HttpServletRequest request) {
        return start(request, false);
    }

    @PostMapping("/re-enroll")
    public ResponseEntity<?> reEnroll(HttpServletRequest request) {
        return start(request, true);
    }

    @GetMapping("/enrollment/status")
    public ResponseEntity<?> status(HttpServletRequest request) {
        User user = getCurrentUser(request);
        if (user == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        EnrollmentStatusResponse status = enrollmentQueryService.status(user.getId());
        return ResponseEntity.ok(status);
    }

    @DeleteMapping("/data")
    public ResponseEntity<?> deleteData(HttpServletRequest request) {
        User user = getCurrentUser(request);
        if (user == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        int removed = operationService.deleteBiometricData(user, request.getRemoteAddr());
        log.info("Biometric data deleted: userId={}, enrollmentRecords={}", user.getId(), removed);
        return ResponseEntity.ok(Map.of("message", "Biometric data deleted successfully"));
    }

    private ResponseEntity<?> start(HttpServletRequest request, boolean reEnroll) {
        User user = getCurrentUser(request);
        if (user == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        OperationStartResponse response = operationService.startEnrollment(user, reEnroll, request.getRemoteAddr());
        log.info("Enrollment started: userId={}, operationId={}, reEnroll={}",
                user.getId(), response.getOperationId(), reEnroll);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    private User getCurrentUser(HttpServletRequest request) {
        return (User) request.getAttribute(SessionAuthFilter.CURRENT_USER_ATTRIBUTE);
    }
}
