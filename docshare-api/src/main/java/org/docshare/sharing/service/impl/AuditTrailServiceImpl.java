package org.docshare.sharing.service.impl;

import lombok.RequiredArgsConstructor;
import org.docshare.sharing.config.SharingProperties;
import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.AuditEntry;
import org.docshare.sharing.service.AuditTrailService;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class AuditTrailServiceImpl implements AuditTrailService {

    private final SharingProperties sharingProperties;

    @Override
    public List<AuditEntry> record(List<AuditEntry> trail, List<AccountPermission> accounts, String actorId,
                                   OffsetDateTime updatedAt) {
        List<AuditEntry> updated = new ArrayList<>(accounts.size() + trail.size());
        // newest first: the last account of the list ends up on top
        for (int i = accounts.size() - 1; i >= 0; i--) {
            updated.add(AuditEntry.of(accounts.get(i), updatedAt, actorId));
        }
        updated.addAll(trail);
        int limit = sharingProperties.getAuditTrailLimit();
        return updated.size() > limit ? List.copyOf(updated.subList(0, limit)) : List.copyOf(updated);
    }
}
