package com.bbms.authbroker.modules.detection;

/**
 * Acknowledgement returned to whoever delivered a completion signal.
 */
public enum SignalAck {
    /** The signal decided the operation. */
    ACCEPTED,
    /** Not a recognized completion shape; logged and dropped. */
    IGNORED,
    /** Another signal already decided the operation. */
    ALREADY_TERMINAL
}
