package org.docshare.sharing.entity;

import io.swagger.v3.oas.annotations.media.Schema;
import org.docshare.sharing.enums.PermissionLevel;

import java.time.OffsetDateTime;

@Schema(description = "Collaborator change recorded in the audit trail")
public record AuditEntry(
        String accountId,
        String email,
        PermissionLevel permission,
        OffsetDateTime updatedAt,
        @Schema(description = "Identity of the actor who made the change") String updatedBy) {

    public static AuditEntry of(AccountPermission account, OffsetDateTime updatedAt, String updatedBy) {
        return new AuditEntry(account.accountId(), account.email(), account.permission(), updatedAt, updatedBy);
    }
}
