package com.bbms.authbroker.modules.operation;

/**
 * Thrown when a proof result is requested before the provider can serve it.
 */
public class ResultNotReadyException extends RuntimeException {

    public ResultNotReadyException(String operationId) {
        super("Result not ready for operation " + operationId);
    }
}
