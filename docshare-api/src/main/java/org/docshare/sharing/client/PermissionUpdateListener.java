package org.docshare.sharing.client;

import org.docshare.sharing.entity.PermissionRecord;

@FunctionalInterface
public interface PermissionUpdateListener {

    /**
     * Called once per confirmed mutation with the authoritative record.
     */
    void onPermissionsUpdate(PermissionRecord permissions);
}
