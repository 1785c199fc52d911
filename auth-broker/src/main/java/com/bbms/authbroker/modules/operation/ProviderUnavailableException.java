package com.bbms.authbroker.modules.operation;

/**
 * Thrown when the biometric provider is unreachable or answers with a 5xx.
 * Retryable.
 */
public class ProviderUnavailableException extends RuntimeException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
