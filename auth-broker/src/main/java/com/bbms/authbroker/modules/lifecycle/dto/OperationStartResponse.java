package com.bbms.authbroker.modules.lifecycle.dto;

import com.bbms.authbroker.model.OperationKind;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.OffsetDateTime;

@Getter
@AllArgsConstructor
public class OperationStartResponse {
    private final String operationId;
    private final OperationKind kind;
    /** Capture-surface URL carrying the one-time secret. */
    private final String captureUrl;
    private final OffsetDateTime expiresAt;
}
