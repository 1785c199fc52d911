package com.bbms.authbroker.modules.operation.dto;

public enum RemoteResult {
    NONE,
    SUCCESS,
    FAILURE;

    /** Provider codes: 0=None, 1=Success, 2=Failure. */
    public static RemoteResult fromCode(Integer code) {
        if (code == null) {
            return NONE;
        }
        return switch (code) {
            case 1 -> SUCCESS;
            case 2 -> FAILURE;
            default -> NONE;
        };
    }
}
