package org.docshare.sharing.service;

import org.docshare.sharing.dto.response.AccessDecision;
import org.docshare.sharing.dto.response.DocumentInfo;
import org.docshare.sharing.security.IdentityContext;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read path: applies the visibility resolver to documents of the catalog.
 */
public interface DocumentAccessService {

    /**
     * Documents the caller may see, in catalog order.
     *
     * @param identity caller, null for anonymous callers (fails with UnauthenticatedException)
     */
    Flux<DocumentInfo> listVisibleDocuments(IdentityContext identity);

    /**
     * Access decision for one document. Fails when access is denied or the document is unknown.
     */
    Mono<AccessDecision> checkAccess(String documentId, IdentityContext identity);
}
