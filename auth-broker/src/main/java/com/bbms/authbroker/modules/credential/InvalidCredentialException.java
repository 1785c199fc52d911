package com.bbms.authbroker.modules.credential;

/**
 * Unknown, expired or revoked token.
 */
public class InvalidCredentialException extends RuntimeException {

    public InvalidCredentialException(String message) {
        super(message);
    }
}
