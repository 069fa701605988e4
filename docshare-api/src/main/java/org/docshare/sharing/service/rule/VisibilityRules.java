package org.docshare.sharing.service.rule;

import org.docshare.sharing.config.SharingProperties;
import org.docshare.sharing.dto.response.AccessDecision;
import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.enums.AccessPath;
import org.docshare.sharing.enums.PermissionLevel;
import org.docshare.sharing.enums.Visibility;
import org.docshare.sharing.security.IdentityContext;

import java.util.Collections;
import java.util.List;

import static org.docshare.sharing.utils.SharingInputUtils.emailDomain;

/**
 * Ordered visibility rules. The order is a policy: the first matching rule decides.
 * <ol>
 *     <li>global administrator: full access</li>
 *     <li>document owner: full access</li>
 *     <li>explicit assignment, either side: edit</li>
 *     <li>account allow-list, when the document is shared with accounts: the account level</li>
 *     <li>public document: read</li>
 *     <li>restricted document whose domain allow-list does not contain the caller's email domain: denied</li>
 *     <li>one of the document's required roles: read</li>
 *     <li>delegated administrator of the document's team: read</li>
 * </ol>
 * When no rule matches, access is denied.
 */
public final class VisibilityRules {

    private VisibilityRules() {
    }

    public static List<AccessRule> ordered(SharingProperties properties) {
        String adminRole = properties.getAdminRole();
        String delegatedAdminRole = properties.getDelegatedAdminRole();
        return List.of(
                new AccessRule(AccessPath.ADMINISTRATOR,
                        r -> r.identity().hasRole(adminRole),
                        r -> AccessDecision.granted(PermissionLevel.FULL, AccessPath.ADMINISTRATOR)),
                new AccessRule(AccessPath.OWNER,
                        r -> r.document().isOwnedBy(r.identity().id()),
                        r -> AccessDecision.granted(PermissionLevel.FULL, AccessPath.OWNER)),
                new AccessRule(AccessPath.ASSIGNMENT,
                        r -> r.identity().isAssignedTo(r.document().getId())
                                || r.document().getAssignedUserIds().contains(r.identity().id()),
                        r -> AccessDecision.granted(PermissionLevel.EDIT, AccessPath.ASSIGNMENT)),
                new AccessRule(AccessPath.ACCOUNT,
                        r -> r.permissions().visibility() == Visibility.ACCOUNT && account(r) != null,
                        r -> AccessDecision.granted(account(r).permission(), AccessPath.ACCOUNT)),
                new AccessRule(AccessPath.PUBLIC,
                        r -> r.permissions().visibility() == Visibility.PUBLIC,
                        r -> AccessDecision.granted(PermissionLevel.READ, AccessPath.PUBLIC)),
                new AccessRule(AccessPath.DOMAIN,
                        r -> isOutsideAllowedDomains(r.permissions(), r.identity()),
                        r -> AccessDecision.denied(AccessPath.DOMAIN)),
                new AccessRule(AccessPath.ROLE,
                        r -> !Collections.disjoint(r.identity().roles(), r.document().getRequiredRoles()),
                        r -> AccessDecision.granted(PermissionLevel.READ, AccessPath.ROLE)),
                new AccessRule(AccessPath.DELEGATED_TEAM,
                        r -> r.identity().hasRole(delegatedAdminRole) && r.identity().administers(r.document().getTeam()),
                        r -> AccessDecision.granted(PermissionLevel.READ, AccessPath.DELEGATED_TEAM))
        );
    }

    private static AccountPermission account(AccessRequest request) {
        IdentityContext identity = request.identity();
        return request.permissions().findAccount(identity.id(), identity.email()).orElse(null);
    }

    // an empty allow-list leaves the gate open
    private static boolean isOutsideAllowedDomains(PermissionRecord permissions, IdentityContext identity) {
        return permissions.visibility() == Visibility.RESTRICTED
                && !permissions.domains().isEmpty()
                && !permissions.allowsDomain(emailDomain(identity.email()));
    }
}
