package org.docshare.sharing.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import org.docshare.sharing.enums.PermissionLevel;
import org.docshare.sharing.enums.Visibility;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentInfo(
        @Schema(description = "ID of the document") String id,
        @Schema(description = "Title of the document") String title,
        @Schema(description = "Team owning the document") String team,
        @Schema(description = "Roles giving read access, sorted") List<String> requiredRoles,
        @Schema(description = "Current visibility mode") Visibility visibility,
        @Schema(description = "Level granted to the caller") PermissionLevel level) {
}
