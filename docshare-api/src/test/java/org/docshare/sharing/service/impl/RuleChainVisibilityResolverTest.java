package org.docshare.sharing.service.impl;

import org.docshare.sharing.config.SharingProperties;
import org.docshare.sharing.dto.response.AccessDecision;
import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.Document;
import org.docshare.sharing.entity.DomainRestriction;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.enums.AccessPath;
import org.docshare.sharing.enums.PermissionLevel;
import org.docshare.sharing.enums.Visibility;
import org.docshare.sharing.exception.AccessForbiddenException;
import org.docshare.sharing.exception.UnauthenticatedException;
import org.docshare.sharing.security.IdentityContext;
import org.docshare.sharing.service.rule.AccessRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleChainVisibilityResolverTest {

    private final RuleChainVisibilityResolver resolver = new RuleChainVisibilityResolver(new SharingProperties());

    private static final Document HANDBOOK = Document.builder()
            .id("doc-employee-handbook")
            .title("Employee Handbook")
            .team("people")
            .assignedUserId("user-alice")
            .requiredRole("employee")
            .build();

    private static final Document NORTH_OPS = Document.builder()
            .id("doc-north-ops")
            .title("Northern Operations Plan")
            .team("north")
            .ownerId("user-olga")
            .requiredRole("operations")
            .build();

    private static IdentityContext identity(String id, String email, Set<String> roles, Set<String> delegatedTeams) {
        return new IdentityContext(id, email, roles, Set.of(), delegatedTeams);
    }

    private static PermissionRecord restricted(String documentId) {
        return PermissionRecord.defaultFor(documentId, Visibility.RESTRICTED);
    }

    @Test
    void rulesAreEvaluatedInPolicyOrder() {
        List<AccessPath> paths = resolver.getRules().stream().map(AccessRule::path).toList();

        assertEquals(List.of(AccessPath.ADMINISTRATOR, AccessPath.OWNER, AccessPath.ASSIGNMENT, AccessPath.ACCOUNT,
                AccessPath.PUBLIC, AccessPath.DOMAIN, AccessPath.ROLE, AccessPath.DELEGATED_TEAM), paths);
    }

    @Test
    void anonymousCaller_isDeniedAsUnauthenticated() {
        PermissionRecord permissions = PermissionRecord.defaultFor(NORTH_OPS.getId(), Visibility.PUBLIC);

        assertEquals(AccessDecision.denied(AccessPath.UNAUTHENTICATED), resolver.evaluate(NORTH_OPS, permissions, null));
        assertThrows(UnauthenticatedException.class, () -> resolver.resolve(NORTH_OPS, permissions, null));
        assertFalse(resolver.isVisible(NORTH_OPS, permissions, null));
    }

    @Test
    void administrator_getsFullAccessEverywhere() {
        IdentityContext admin = identity("user-root", "root@other.org", Set.of("admin"), Set.of());
        PermissionRecord permissions = restricted(NORTH_OPS.getId())
                .withDomains(List.of(new DomainRestriction("example.com")));

        AccessDecision decision = resolver.resolve(NORTH_OPS, permissions, admin);

        assertEquals(PermissionLevel.FULL, decision.level());
        assertEquals(AccessPath.ADMINISTRATOR, decision.path());
    }

    @Test
    void owner_getsFullAccess() {
        IdentityContext owner = identity("user-olga", null, Set.of(), Set.of());

        AccessDecision decision = resolver.resolve(NORTH_OPS, restricted(NORTH_OPS.getId()), owner);

        assertEquals(AccessDecision.granted(PermissionLevel.FULL, AccessPath.OWNER), decision);
    }

    @Test
    void assignmentOnDocumentSide_grantsEditEvenOutsideAllowedDomains() {
        IdentityContext alice = identity("user-alice", "alice@elsewhere.net", Set.of(), Set.of());
        PermissionRecord permissions = restricted(HANDBOOK.getId())
                .withDomains(List.of(new DomainRestriction("example.com")));

        AccessDecision decision = resolver.resolve(HANDBOOK, permissions, alice);

        assertEquals(AccessDecision.granted(PermissionLevel.EDIT, AccessPath.ASSIGNMENT), decision);
    }

    @Test
    void assignmentOnIdentitySide_grantsEdit() {
        IdentityContext carl = new IdentityContext("user-carl", null, Set.of(), Set.of(NORTH_OPS.getId()), Set.of());

        assertEquals(AccessPath.ASSIGNMENT, resolver.resolve(NORTH_OPS, restricted(NORTH_OPS.getId()), carl).path());
    }

    @Test
    void accountAllowList_grantsTheAccountLevel_matchedByEmail() {
        IdentityContext bob = identity("user-bob", "Bob@Example.com", Set.of(), Set.of());
        PermissionRecord permissions = PermissionRecord.defaultFor(NORTH_OPS.getId(), Visibility.ACCOUNT)
                .withAccounts(List.of(new AccountPermission("acc-7", "bob@example.com", PermissionLevel.COMMENT)));

        AccessDecision decision = resolver.resolve(NORTH_OPS, permissions, bob);

        assertEquals(AccessDecision.granted(PermissionLevel.COMMENT, AccessPath.ACCOUNT), decision);
    }

    @Test
    void accountAllowList_isIgnoredOutsideAccountMode() {
        IdentityContext bob = identity("user-bob", "bob@example.com", Set.of(), Set.of());
        PermissionRecord permissions = restricted(NORTH_OPS.getId())
                .withAccounts(List.of(new AccountPermission("user-bob", "bob@example.com", PermissionLevel.EDIT)));

        assertFalse(resolver.evaluate(NORTH_OPS, permissions, bob).granted());
    }

    @Test
    void publicDocument_grantsReadToAnyIdentity() {
        IdentityContext nobody = identity("user-x", null, Set.of(), Set.of());
        PermissionRecord permissions = PermissionRecord.defaultFor(NORTH_OPS.getId(), Visibility.PUBLIC);

        assertEquals(AccessDecision.granted(PermissionLevel.READ, AccessPath.PUBLIC),
                resolver.resolve(NORTH_OPS, permissions, nobody));
        assertTrue(resolver.isVisible(NORTH_OPS, permissions, nobody));
    }

    @Test
    void domainGate_deniesRoleHolderFromOtherDomain() {
        IdentityContext operator = identity("user-op", "op@other.org", Set.of("operations"), Set.of());
        PermissionRecord permissions = restricted(NORTH_OPS.getId())
                .withDomains(List.of(new DomainRestriction("example.com")));

        AccessDecision decision = resolver.evaluate(NORTH_OPS, permissions, operator);

        assertEquals(AccessDecision.denied(AccessPath.DOMAIN), decision);
        assertThrows(AccessForbiddenException.class, () -> resolver.resolve(NORTH_OPS, permissions, operator));
    }

    @Test
    void domainGate_letsMatchingDomainThroughToRoleCheck() {
        IdentityContext operator = identity("user-op", "op@Example.com", Set.of("operations"), Set.of());
        PermissionRecord permissions = restricted(NORTH_OPS.getId())
                .withDomains(List.of(new DomainRestriction("example.com")));

        assertEquals(AccessDecision.granted(PermissionLevel.READ, AccessPath.ROLE),
                resolver.resolve(NORTH_OPS, permissions, operator));
    }

    @Test
    void domainGate_withEmptyAllowList_isOpen() {
        IdentityContext operator = identity("user-op", null, Set.of("operations"), Set.of());

        assertEquals(AccessPath.ROLE, resolver.resolve(NORTH_OPS, restricted(NORTH_OPS.getId()), operator).path());
    }

    @Test
    void delegatedAdministrator_readsDocumentsOfDelegatedTeamsOnly() {
        IdentityContext sam = identity("user-sam", null, Set.of("sub_admin"), Set.of("north"));
        Document southOps = Document.builder().id("doc-south-ops").team("south").requiredRole("operations").build();

        assertEquals(AccessDecision.granted(PermissionLevel.READ, AccessPath.DELEGATED_TEAM),
                resolver.resolve(NORTH_OPS, restricted(NORTH_OPS.getId()), sam));
        assertEquals(AccessDecision.denied(AccessPath.NONE),
                resolver.evaluate(southOps, restricted(southOps.getId()), sam));
    }

    @Test
    void delegatedTeams_withoutDelegatedRole_grantNothing() {
        IdentityContext eve = identity("user-eve", null, Set.of("employee"), Set.of("north"));

        assertFalse(resolver.evaluate(NORTH_OPS, restricted(NORTH_OPS.getId()), eve).granted());
    }

    @Test
    void documentWithoutRequiredRoles_isNotGrantedByRoles() {
        Document untagged = Document.builder().id("doc-untagged").team("people").build();
        IdentityContext alice = identity("user-bea", null, Set.of("employee"), Set.of());

        assertEquals(AccessDecision.denied(AccessPath.NONE), resolver.evaluate(untagged, restricted("doc-untagged"), alice));
    }

    @Test
    void customRoleNames_areHonoured() {
        SharingProperties properties = new SharingProperties();
        properties.setAdminRole("superuser");
        RuleChainVisibilityResolver custom = new RuleChainVisibilityResolver(properties);

        assertEquals(AccessPath.ADMINISTRATOR, custom.resolve(NORTH_OPS, restricted(NORTH_OPS.getId()),
                identity("user-1", null, Set.of("superuser"), Set.of())).path());
        assertFalse(custom.evaluate(NORTH_OPS, restricted(NORTH_OPS.getId()),
                identity("user-2", null, Set.of("admin"), Set.of())).granted());
    }
}
