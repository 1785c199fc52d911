package com.bbms.authbroker.modules.lifecycle;

import java.util.UUID;

/**
 * Enrollment requested for a user who already holds a completed enrollment.
 * Re-enrollment is the explicit route for replacing it.
 */
public class AlreadyEnrolledException extends RuntimeException {

    public AlreadyEnrolledException(UUID userId) {
        super("User already has a completed biometric enrollment: " + userId);
    }
}
