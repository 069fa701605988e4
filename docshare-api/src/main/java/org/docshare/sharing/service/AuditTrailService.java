package org.docshare.sharing.service;

import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.AuditEntry;

import java.time.OffsetDateTime;
import java.util.List;

public interface AuditTrailService {

    /**
     * Returns a new trail with one entry per account prepended, all sharing {@code updatedAt},
     * truncated to the configured limit (oldest entries dropped first).
     */
    List<AuditEntry> record(List<AuditEntry> trail, List<AccountPermission> accounts, String actorId,
                            OffsetDateTime updatedAt);
}
