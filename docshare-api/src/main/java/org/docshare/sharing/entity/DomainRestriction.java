package org.docshare.sharing.entity;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Email domain allowed to access a restricted document")
public record DomainRestriction(@Schema(description = "Lowercase domain, e.g. example.com") String domain) {
}
