package com.bbms.authbroker.modules.lifecycle;

public class OperationNotFoundException extends RuntimeException {

    public OperationNotFoundException(String operationId) {
        super("Biometric operation not found: " + operationId);
    }
}
