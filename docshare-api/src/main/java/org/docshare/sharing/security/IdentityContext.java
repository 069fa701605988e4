package org.docshare.sharing.security;

import java.util.Set;

/**
 * Caller identity for the lifetime of one request.
 *
 * @param id             user identifier, never blank
 * @param email          email used for domain restrictions, may be null
 * @param roles          roles granted by the authentication proxy
 * @param assignments    ids of documents explicitly assigned to the caller
 * @param delegatedTeams teams the caller administers on behalf of the global owner
 */
public record IdentityContext(String id, String email, Set<String> roles, Set<String> assignments,
                              Set<String> delegatedTeams) {

    public IdentityContext {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        assignments = assignments == null ? Set.of() : Set.copyOf(assignments);
        delegatedTeams = delegatedTeams == null ? Set.of() : Set.copyOf(delegatedTeams);
    }

    public boolean hasRole(String role) {
        return role != null && roles.contains(role);
    }

    public boolean isAssignedTo(String documentId) {
        return assignments.contains(documentId);
    }

    public boolean administers(String team) {
        return team != null && delegatedTeams.contains(team);
    }
}
