package org.docshare.sharing.service;

import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.DomainRestriction;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.enums.Visibility;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Validates and applies permission changes. Each operation is atomic for its document id and
 * emits the new authoritative record. Invalid input fails with
 * {@link org.docshare.sharing.exception.PermissionValidationException} and leaves the record untouched.
 */
public interface PermissionService {

    /**
     * Current record, created with default values on first access.
     */
    Mono<PermissionRecord> getPermissions(String documentId);

    /**
     * Sets the visibility mode. Switching to public clears both allow-lists in the same step.
     */
    Mono<PermissionRecord> setVisibility(String documentId, Visibility visibility, String actorId);

    /**
     * Replaces the domain allow-list and forces restricted visibility.
     */
    Mono<PermissionRecord> setDomainRestrictions(String documentId, List<DomainRestriction> domains, String actorId);

    /**
     * Replaces the account allow-list, forces account visibility and records one audit entry per account.
     */
    Mono<PermissionRecord> setAccountPermissions(String documentId, List<AccountPermission> accounts, String actorId);

    /**
     * Removes one account. Removing an unknown account returns the record unchanged without an audit entry.
     */
    Mono<PermissionRecord> removeAccountPermission(String documentId, String accountId, String actorId);

    /**
     * Drops the record of a document deleted by the document subsystem.
     */
    Mono<Void> invalidate(String documentId);
}
