package org.docshare.sharing.entity;

import io.swagger.v3.oas.annotations.media.Schema;
import org.docshare.sharing.enums.PermissionLevel;

@Schema(description = "Named account allowed to access a document")
public record AccountPermission(
        @Schema(description = "Account identifier") String accountId,
        @Schema(description = "Email of the account") String email,
        @Schema(description = "Granted level: read, comment or edit") PermissionLevel permission) {

    public AccountPermission withPermission(PermissionLevel level) {
        return new AccountPermission(accountId, email, level);
    }
}
