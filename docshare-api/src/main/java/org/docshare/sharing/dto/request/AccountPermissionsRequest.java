package org.docshare.sharing.dto.request;

import jakarta.validation.constraints.NotBlank;
import org.docshare.sharing.entity.AccountPermission;

import java.util.List;

public record AccountPermissionsRequest(List<AccountPermission> accounts, @NotBlank String actorId) {
}
