package com.bbms.authbroker.model;

/**
 * What a provider operation is for. Enrollment binds a face template to the
 * account; authentication verifies a returning user against it.
 */
public enum OperationKind {
    ENROLLMENT,
    AUTHENTICATION
}
