package org.docshare.sharing.client;

import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.DomainRestriction;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.enums.Visibility;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Remote permission authority. Network and server failures surface as
 * {@link org.docshare.sharing.exception.TransientIOException}, rejected input as
 * {@link org.docshare.sharing.exception.PermissionValidationException}.
 */
public interface PermissionClient {

    Mono<PermissionRecord> fetchPermissions(String documentId);

    Mono<PermissionRecord> updateVisibility(String documentId, Visibility visibility, String actorId);

    Mono<PermissionRecord> updateDomainRestrictions(String documentId, List<DomainRestriction> domains, String actorId);

    Mono<PermissionRecord> updateAccountPermissions(String documentId, List<AccountPermission> accounts, String actorId);

    Mono<PermissionRecord> removeAccountPermission(String documentId, String accountId, String actorId);
}
