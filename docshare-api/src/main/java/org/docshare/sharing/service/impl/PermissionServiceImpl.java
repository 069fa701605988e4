package org.docshare.sharing.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.DomainRestriction;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.enums.Visibility;
import org.docshare.sharing.exception.PermissionValidationException;
import org.docshare.sharing.repository.PermissionStore;
import org.docshare.sharing.service.AuditTrailService;
import org.docshare.sharing.service.PermissionInputValidator;
import org.docshare.sharing.service.PermissionService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.docshare.sharing.service.PermissionInputValidator.requireActor;
import static org.docshare.sharing.service.PermissionInputValidator.requireDocumentId;

@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionServiceImpl implements PermissionService {

    private final PermissionStore permissionStore;
    private final AuditTrailService auditTrailService;
    private final Clock clock;

    @Override
    public Mono<PermissionRecord> getPermissions(String documentId) {
        return Mono.fromCallable(() -> permissionStore.get(requireDocumentId(documentId)));
    }

    @Override
    public Mono<PermissionRecord> setVisibility(String documentId, Visibility visibility, String actorId) {
        return Mono.fromCallable(() -> {
            requireDocumentId(documentId);
            String actor = requireActor(actorId);
            if (visibility == null) {
                throw new PermissionValidationException("Visibility is required");
            }
            PermissionRecord updated = permissionStore.update(documentId, current -> visibility == Visibility.PUBLIC
                    ? current.withVisibility(Visibility.PUBLIC).withDomains(List.of()).withAccounts(List.of())
                    : current.withVisibility(visibility));
            log.info("User {} set visibility of document {} to {}", actor, documentId, visibility);
            return updated;
        });
    }

    @Override
    public Mono<PermissionRecord> setDomainRestrictions(String documentId, List<DomainRestriction> domains, String actorId) {
        return Mono.fromCallable(() -> {
            requireDocumentId(documentId);
            String actor = requireActor(actorId);
            List<DomainRestriction> normalized = PermissionInputValidator.domains(domains);
            PermissionRecord updated = permissionStore.update(documentId, current -> current
                    .withVisibility(Visibility.RESTRICTED)
                    .withDomains(normalized));
            log.info("User {} restricted document {} to domains {}", actor, documentId, normalized);
            return updated;
        });
    }

    @Override
    public Mono<PermissionRecord> setAccountPermissions(String documentId, List<AccountPermission> accounts, String actorId) {
        return Mono.fromCallable(() -> {
            requireDocumentId(documentId);
            String actor = requireActor(actorId);
            List<AccountPermission> normalized = PermissionInputValidator.accounts(accounts);
            PermissionRecord updated = permissionStore.update(documentId, current -> current
                    .withVisibility(Visibility.ACCOUNT)
                    .withAccounts(normalized)
                    .withAuditTrail(auditTrailService.record(current.auditTrail(), normalized, actor, now())));
            log.info("User {} shared document {} with {} account(s)", actor, documentId, normalized.size());
            return updated;
        });
    }

    @Override
    public Mono<PermissionRecord> removeAccountPermission(String documentId, String accountId, String actorId) {
        return Mono.fromCallable(() -> {
            requireDocumentId(documentId);
            String actor = requireActor(actorId);
            if (accountId == null || accountId.isBlank()) {
                throw new PermissionValidationException("Account id is required");
            }
            AtomicBoolean removed = new AtomicBoolean();
            PermissionRecord updated = permissionStore.update(documentId, current -> {
                List<AccountPermission> remaining = current.accounts().stream()
                        .filter(account -> !account.accountId().equals(accountId))
                        .toList();
                if (remaining.size() == current.accounts().size()) {
                    log.debug("Account {} not shared on document {}, nothing to remove", accountId, documentId);
                    return current;
                }
                removed.set(true);
                return current
                        .withAccounts(remaining)
                        .withAuditTrail(auditTrailService.record(current.auditTrail(), remaining, actor, now()));
            });
            if (removed.get()) {
                log.info("User {} removed account {} from document {}", actor, accountId, documentId);
            }
            return updated;
        });
    }

    @Override
    public Mono<Void> invalidate(String documentId) {
        return Mono.fromRunnable(() -> permissionStore.evict(requireDocumentId(documentId)));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
