package org.docshare.sharing.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Document metadata owned by the document subsystem. Read-only for permission resolution.
 */
@Value
@Builder
public class Document {

    String id;

    String title;

    /**
     * Owning scope, matched against the delegated teams of sub-administrators.
     */
    String team;

    String ownerId;

    @Singular
    Set<String> requiredRoles;

    @Singular
    Set<String> assignedUserIds;

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }
}
