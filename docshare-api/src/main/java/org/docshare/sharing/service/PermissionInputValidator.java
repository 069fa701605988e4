package org.docshare.sharing.service;

import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.DomainRestriction;
import org.docshare.sharing.exception.PermissionValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.docshare.sharing.utils.SharingInputUtils.isValidDomain;
import static org.docshare.sharing.utils.SharingInputUtils.isValidEmail;
import static org.docshare.sharing.utils.SharingInputUtils.normalizeDomain;
import static org.docshare.sharing.utils.SharingInputUtils.normalizeEmail;

/**
 * Validation and normalization of permission updates, shared by the service and the client coordinator.
 * Every method fails with {@link PermissionValidationException} before anything is mutated.
 */
public final class PermissionInputValidator {

    public static final String DOMAIN_REQUIRED = "Add at least one domain.";
    public static final String ACCOUNT_REQUIRED = "Add at least one collaborator.";

    private PermissionInputValidator() {
    }

    public static String requireDocumentId(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new PermissionValidationException("Document id is required");
        }
        return documentId;
    }

    public static String requireActor(String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new PermissionValidationException("Actor id is required");
        }
        return actorId.trim();
    }

    /**
     * Normalizes (trim, strip leading '@', lowercase) and de-duplicates domains, keeping the first occurrence.
     */
    public static List<DomainRestriction> domains(List<DomainRestriction> domains) {
        if (domains == null || domains.isEmpty()) {
            throw new PermissionValidationException(DOMAIN_REQUIRED);
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (DomainRestriction restriction : domains) {
            String domain = restriction == null ? null : normalizeDomain(restriction.domain());
            if (!isValidDomain(domain)) {
                throw new PermissionValidationException("Invalid domain : " + (restriction == null ? null : restriction.domain()));
            }
            normalized.add(domain);
        }
        return normalized.stream().map(DomainRestriction::new).toList();
    }

    /**
     * Checks every account and lowercases emails. Account ids must be unique.
     */
    public static List<AccountPermission> accounts(List<AccountPermission> accounts) {
        if (accounts == null || accounts.isEmpty()) {
            throw new PermissionValidationException(ACCOUNT_REQUIRED);
        }
        Set<String> ids = new HashSet<>();
        List<AccountPermission> normalized = new ArrayList<>(accounts.size());
        for (AccountPermission account : accounts) {
            if (account == null || account.accountId() == null || account.accountId().isBlank()) {
                throw new PermissionValidationException("Account id is required");
            }
            String email = normalizeEmail(account.email());
            if (!isValidEmail(email)) {
                throw new PermissionValidationException("Invalid email : " + account.email());
            }
            if (account.permission() == null || !account.permission().isShareable()) {
                throw new PermissionValidationException("Invalid permission level for account " + account.accountId()
                        + " : " + account.permission());
            }
            if (!ids.add(account.accountId())) {
                throw new PermissionValidationException("Duplicate account : " + account.accountId());
            }
            normalized.add(new AccountPermission(account.accountId(), email, account.permission()));
        }
        return List.copyOf(normalized);
    }
}
