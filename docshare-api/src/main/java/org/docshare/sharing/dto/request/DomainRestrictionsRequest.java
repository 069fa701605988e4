package org.docshare.sharing.dto.request;

import jakarta.validation.constraints.NotBlank;
import org.docshare.sharing.entity.DomainRestriction;

import java.util.List;

public record DomainRestrictionsRequest(List<DomainRestriction> domains, @NotBlank String actorId) {
}
