package org.docshare.sharing.service.impl;

import org.docshare.sharing.config.SharingProperties;
import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.AuditEntry;
import org.docshare.sharing.enums.PermissionLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditTrailServiceImplTest {

    private static final OffsetDateTime AT = OffsetDateTime.of(2024, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    private SharingProperties properties;
    private AuditTrailServiceImpl auditTrailService;

    @BeforeEach
    void setUp() {
        properties = new SharingProperties();
        auditTrailService = new AuditTrailServiceImpl(properties);
    }

    @Test
    void record_prependsOneEntryPerAccountWithSharedTimestamp() {
        AuditEntry previous = new AuditEntry("acc-0", "old@example.com", PermissionLevel.READ, AT.minusDays(1), "owner-1");
        List<AccountPermission> accounts = List.of(
                new AccountPermission("acc-1", "a@example.com", PermissionLevel.READ),
                new AccountPermission("acc-2", "b@example.com", PermissionLevel.EDIT));

        List<AuditEntry> trail = auditTrailService.record(List.of(previous), accounts, "owner-1", AT);

        assertEquals(3, trail.size());
        assertEquals("acc-2", trail.get(0).accountId());
        assertEquals("acc-1", trail.get(1).accountId());
        assertEquals(previous, trail.get(2));
        assertEquals(AT, trail.get(0).updatedAt());
        assertEquals(AT, trail.get(1).updatedAt());
        assertEquals("owner-1", trail.get(0).updatedBy());
    }

    @Test
    void record_truncatesToConfiguredLimit() {
        properties.setAuditTrailLimit(3);
        List<AuditEntry> existing = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            existing.add(new AuditEntry("old-" + i, "old" + i + "@example.com", PermissionLevel.READ, AT, "owner-1"));
        }

        List<AuditEntry> trail = auditTrailService.record(existing,
                List.of(new AccountPermission("acc-1", "a@example.com", PermissionLevel.COMMENT)), "owner-1", AT);

        assertEquals(3, trail.size());
        assertEquals("acc-1", trail.get(0).accountId());
        assertEquals("old-1", trail.get(2).accountId());
    }

    @Test
    void record_withNoAccounts_keepsTrail() {
        AuditEntry previous = new AuditEntry("acc-0", "old@example.com", PermissionLevel.READ, AT, "owner-1");

        assertEquals(List.of(previous), auditTrailService.record(List.of(previous), List.of(), "owner-1", AT));
    }
}
