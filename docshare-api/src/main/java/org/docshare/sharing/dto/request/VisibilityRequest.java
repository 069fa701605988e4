package org.docshare.sharing.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.docshare.sharing.enums.Visibility;

public record VisibilityRequest(@NotNull Visibility visibility, @NotBlank String actorId) {
}
