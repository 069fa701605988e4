package org.docshare.sharing.service.rule;

import org.docshare.sharing.entity.Document;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.security.IdentityContext;

/**
 * Input of the visibility rules. The identity is never null once the rules run.
 */
public record AccessRequest(Document document, PermissionRecord permissions, IdentityContext identity) {
}
