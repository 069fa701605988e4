package org.docshare.sharing.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import org.docshare.sharing.enums.AccessPath;
import org.docshare.sharing.enums.PermissionLevel;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessDecision(
        @Schema(description = "Whether access is granted") boolean granted,
        @Schema(description = "Granted level, absent when denied") PermissionLevel level,
        @Schema(description = "Rule that produced the decision") AccessPath path) {

    public static AccessDecision granted(PermissionLevel level, AccessPath path) {
        return new AccessDecision(true, level, path);
    }

    public static AccessDecision denied(AccessPath path) {
        return new AccessDecision(false, null, path);
    }
}
