package com.bbms.authbroker.modules.lifecycle.dto;

import com.bbms.authbroker.model.OperationOutcome;
import com.bbms.authbroker.modules.detection.SignalAck;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CaptureEventResponse {
    private final String operationId;
    private final SignalAck ack;
    private final OperationOutcome status;
}
