package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.modules.lifecycle.dto.LoginInitiateRequest;
import com.bbms.authbroker.modules.lifecycle.dto.OperationStartResponse;
import com.bbms.authbroker.modules.lifecycle.dto.OperationStatusResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Biometric login.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /biometric/login/initiate: start a verification transaction</li>
 * <li>GET /biometric/login/poll/{operationId}: poll until decided</li>
 * </ul>
 * Poll responses: 200 while pending and once with the credential, 202 for
 * manual review, 401 for rejection or expiry, 409 once the credential has
 * already been collected.
 */
@Slf4j
@RestController
@RequestMapping("/biometric/login")
@RequiredArgsConstructor
public class BiometricLoginController {

    private final BiometricOperationService operationService;

    @PostMapping("/initiate")
    public ResponseEntity<OperationStartResponse> initiate(@Valid @RequestBody LoginInitiateRequest request,
            HttpServletRequest httpRequest) {
        OperationStartResponse response = operationService.startAuthentication(
                request.getAccountNumber(), httpRequest.getRemoteAddr());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/poll/{operationId}")
    public ResponseEntity<?> poll(@PathVariable String operationId) {
        OperationStatusResponse status = operationService.loginStatus(operationId);

        return switch (status.getStatus()) {
            case PENDING -> ResponseEntity.ok(status);
            case COMPLETED -> status.getCredential() != null
                    ? ResponseEntity.ok(status)
                    : ResponseEntity.status(HttpStatus.CONFLICT).body(error(status,
                            "CREDENTIAL_ALREADY_DELIVERED", "Credential for this login was already collected"));
            case MANUAL_REVIEW -> ResponseEntity.status(HttpStatus.ACCEPTED).body(error(status,
                    "MANUAL_REVIEW_REQUIRED", "Verification requires manual review"));
            case FAILED -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error(status,
                    "PROOF_REJECTED", "Biometric verification failed"));
            case EXPIRED -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error(status,
                    "OPERATION_EXPIRED", "Biometric verification expired"));
        };
    }

    private static Map<String, Object> error(OperationStatusResponse status, String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", code);
        body.put("message", message);
        body.put("operationId", status.getOperationId());
        body.put("status", status.getStatus());
        body.put("reasons", status.getReasons());
        if (status.getExpiryReason() != null) {
            body.put("expiryReason", status.getExpiryReason());
        }
        return body;
    }
}
