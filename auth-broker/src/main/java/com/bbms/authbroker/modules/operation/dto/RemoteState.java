package com.bbms.authbroker.modules.operation.dto;

/**
 * Provider operation state, plus two local values for polls that produced no
 * usable provider answer.
 */
public enum RemoteState {
    PENDING,
    COMPLETED,
    FAILED,
    EXPIRED,
    /** Provider answered 404: the operation is not registered on the query side yet. */
    NOT_YET_QUERYABLE,
    /** Provider stayed unavailable through the client's retry budget. */
    UNREACHABLE;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EXPIRED;
    }

    /** Provider codes: 0=Pending, 1=Completed, 2=Failed, 3=Expired. */
    public static RemoteState fromCode(Integer code) {
        if (code == null) {
            return PENDING;
        }
        return switch (code) {
            case 1 -> COMPLETED;
            case 2 -> FAILED;
            case 3 -> EXPIRED;
            default -> PENDING;
        };
    }
}
