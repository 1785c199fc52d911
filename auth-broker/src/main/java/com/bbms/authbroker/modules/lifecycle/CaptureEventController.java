package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.modules.detection.dto.CaptureEvent;
import com.bbms.authbroker.modules.lifecycle.dto.CaptureEventResponse;
import com.bbms.authbroker.modules.lifecycle.dto.OperationStatusResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Capture-surface callbacks and operation status.
 * <ul>
 * <li>POST /biometric/operations/{operationId}/events: page events</li>
 * <li>POST /biometric/operations/{operationId}/cancel: user abandoned capture</li>
 * <li>GET /biometric/operations/{operationId}: status, never a credential</li>
 * </ul>
 */
@RestController
@RequestMapping("/biometric/operations")
@RequiredArgsConstructor
public class CaptureEventController {

    private final BiometricOperationService operationService;

    @PostMapping("/{operationId}/events")
    public ResponseEntity<CaptureEventResponse> event(@PathVariable String operationId,
            @Valid @RequestBody CaptureEvent event) {
        return ResponseEntity.ok(operationService.onCaptureEvent(operationId, event));
    }

    @PostMapping("/{operationId}/cancel")
    public ResponseEntity<OperationStatusResponse> cancel(@PathVariable String operationId) {
        return ResponseEntity.ok(operationService.cancel(operationId));
    }

    @GetMapping("/{operationId}")
    public ResponseEntity<OperationStatusResponse> status(@PathVariable String operationId) {
        return ResponseEntity.ok(operationService.status(operationId));
    }
}
