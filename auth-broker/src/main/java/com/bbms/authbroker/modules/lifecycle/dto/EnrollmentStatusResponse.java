package com.bbms.authbroker.modules.lifecycle.dto;

import com.bbms.authbroker.model.OperationState;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;

@Getter
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnrollmentStatusResponse {
    private final boolean enrolled;
    private final String operationId;
    private final OperationState status;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime completedAt;
}
