package com.bbms.authbroker.model;

public enum ProofDecision {
    ACCEPT,
    REJECT,
    MANUAL_REVIEW
}
