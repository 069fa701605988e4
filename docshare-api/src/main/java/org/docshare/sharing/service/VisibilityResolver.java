package org.docshare.sharing.service;

import org.docshare.sharing.dto.response.AccessDecision;
import org.docshare.sharing.entity.Document;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.security.IdentityContext;

/**
 * Decides whether an identity may access a document. Implementations are pure: no I/O, no side effects.
 */
public interface VisibilityResolver {

    /**
     * Evaluates the rule chain without failing. Denied decisions carry the path that denied access.
     *
     * @param identity caller identity, null for anonymous callers
     */
    AccessDecision evaluate(Document document, PermissionRecord permissions, IdentityContext identity);

    /**
     * Evaluates the rule chain and fails when access is denied.
     *
     * @throws org.docshare.sharing.exception.UnauthenticatedException when {@code identity} is null
     * @throws org.docshare.sharing.exception.AccessForbiddenException when no rule grants access
     */
    AccessDecision resolve(Document document, PermissionRecord permissions, IdentityContext identity);

    /**
     * Boolean form of {@link #evaluate}, used to filter listings.
     */
    default boolean isVisible(Document document, PermissionRecord permissions, IdentityContext identity) {
        return evaluate(document, permissions, identity).granted();
    }
}
