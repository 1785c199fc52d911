package com.bbms.authbroker.modules.operation;

/**
 * Thrown when the provider rejects an operation request with a 4xx, or the
 * subject cannot be enrolled or authenticated at all. Not retryable.
 */
public class InvalidSubjectException extends RuntimeException {

    public InvalidSubjectException(String message) {
        super(message);
    }

    public InvalidSubjectException(String message, Throwable cause) {
        super(message, cause);
    }
}
