package org.docshare.sharing.entity;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.With;
import org.docshare.sharing.enums.Visibility;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative sharing configuration of one document. Instances are immutable, every mutation
 * produces a new record.
 */
@With
@Schema(description = "Sharing configuration of a document")
public record PermissionRecord(
        String documentId,
        Visibility visibility,
        List<DomainRestriction> domains,
        List<AccountPermission> accounts,
        @Schema(description = "Newest-first collaborator changes") List<AuditEntry> auditTrail) {

    public PermissionRecord {
        domains = domains == null ? List.of() : List.copyOf(domains);
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }

    public static PermissionRecord defaultFor(String documentId, Visibility visibility) {
        return new PermissionRecord(documentId, visibility, List.of(), List.of(), List.of());
    }

    public Optional<AccountPermission> findAccount(String accountId, String email) {
        return accounts.stream()
                .filter(a -> a.accountId().equals(accountId)
                        || (email != null && a.email() != null && a.email().equalsIgnoreCase(email)))
                .findFirst();
    }

    public boolean allowsDomain(String domain) {
        return domain != null && domains.stream().anyMatch(d -> d.domain().equals(domain));
    }
}
