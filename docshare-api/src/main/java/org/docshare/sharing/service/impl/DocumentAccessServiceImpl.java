package org.docshare.sharing.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.docshare.sharing.dto.response.AccessDecision;
import org.docshare.sharing.dto.response.DocumentInfo;
import org.docshare.sharing.entity.Document;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.exception.DocumentNotFoundException;
import org.docshare.sharing.exception.UnauthenticatedException;
import org.docshare.sharing.repository.DocumentRepository;
import org.docshare.sharing.security.IdentityContext;
import org.docshare.sharing.service.DocumentAccessService;
import org.docshare.sharing.service.PermissionService;
import org.docshare.sharing.service.VisibilityResolver;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentAccessServiceImpl implements DocumentAccessService {

    private final DocumentRepository documentRepository;
    private final PermissionService permissionService;
    private final VisibilityResolver visibilityResolver;

    @Override
    public Flux<DocumentInfo> listVisibleDocuments(IdentityContext identity) {
        if (identity == null) {
            return Flux.error(new UnauthenticatedException());
        }
        return documentRepository.findAll()
                .concatMap(document -> permissionService.getPermissions(document.getId())
                        .mapNotNull(permissions -> toVisibleInfo(document, permissions, identity)))
                .doOnComplete(() -> log.debug("Listed visible documents for {}", identity.id()));
    }

    @Override
    public Mono<AccessDecision> checkAccess(String documentId, IdentityContext identity) {
        if (identity == null) {
            return Mono.error(new UnauthenticatedException());
        }
        return documentRepository.findById(documentId)
                .switchIfEmpty(Mono.error(() -> new DocumentNotFoundException(documentId)))
                .flatMap(document -> permissionService.getPermissions(documentId)
                        .map(permissions -> visibilityResolver.resolve(document, permissions, identity)));
    }

    private DocumentInfo toVisibleInfo(Document document, PermissionRecord permissions, IdentityContext identity) {
        AccessDecision decision = visibilityResolver.evaluate(document, permissions, identity);
        if (!decision.granted()) {
            return null;
        }
        return new DocumentInfo(document.getId(), document.getTitle(), document.getTeam(),
                document.getRequiredRoles().stream().sorted().toList(), permissions.visibility(), decision.level());
    }
}
