package com.bbms.authbroker.modules.operation.dto;

import java.time.OffsetDateTime;

/**
 * One observation of an operation's remote status.
 *
 * @param remoteState state reported by the provider, or a local not-ready marker
 * @param resultCode  result reported by the provider
 * @param completedAt provider completion timestamp; null until genuinely completed
 */
public record OperationStatus(
        RemoteState remoteState,
        RemoteResult resultCode,
        OffsetDateTime completedAt) {

    public static OperationStatus notYetQueryable() {
        return new OperationStatus(RemoteState.NOT_YET_QUERYABLE, RemoteResult.NONE, null);
    }

    public static OperationStatus unreachable() {
        return new OperationStatus(RemoteState.UNREACHABLE, RemoteResult.NONE, null);
    }
}
