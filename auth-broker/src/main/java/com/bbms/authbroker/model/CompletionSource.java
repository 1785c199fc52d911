package com.bbms.authbroker.model;

/** Which completion signal decided an operation. */
public enum CompletionSource {
    EVENT,
    WEBHOOK,
    POLL,
    SWEEPER,
    CALLER
}
