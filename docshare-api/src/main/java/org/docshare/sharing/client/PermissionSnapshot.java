package org.docshare.sharing.client;

import org.docshare.sharing.entity.PermissionRecord;

/**
 * State exposed by the coordinator. {@code optimistic} is true while the record is a prediction
 * not yet confirmed by the authority.
 */
public record PermissionSnapshot(PermissionRecord record, boolean optimistic) {

    public static PermissionSnapshot authoritative(PermissionRecord record) {
        return new PermissionSnapshot(record, false);
    }

    public static PermissionSnapshot predicted(PermissionRecord record) {
        return new PermissionSnapshot(record, true);
    }
}
