package com.bbms.authbroker.modules.lifecycle.dto;

import com.bbms.authbroker.model.ExpiryReason;
import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.model.OperationOutcome;
import com.bbms.authbroker.modules.credential.dto.IssuedCredential;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.List;

@Getter
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationStatusResponse {
    private final String operationId;
    private final OperationKind kind;
    private final OperationOutcome status;
    private final List<String> reasons;
    private final ExpiryReason expiryReason;
    private final OffsetDateTime completedAt;
    private final OffsetDateTime expiresAt;
    /** Present only on the single poll that collects it. */
    private final IssuedCredential credential;
}
