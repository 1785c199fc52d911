package com.bbms.authbroker.modules.operation.dto;

import com.bbms.authbroker.model.OperationKind;

import java.time.OffsetDateTime;

/**
 * Provider response to operation creation. The one-time secret is handed to
 * the capture surface and never persisted.
 */
public record CreatedOperation(
        String operationId,
        OperationKind kind,
        String secret,
        OffsetDateTime expiresAt) {
}
