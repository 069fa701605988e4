package org.docshare.sharing.controller.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.docshare.sharing.config.RestApiVersion;
import org.docshare.sharing.config.SharingProperties;
import org.docshare.sharing.dto.request.AccountPermissionsRequest;
import org.docshare.sharing.dto.request.ActorRequest;
import org.docshare.sharing.dto.request.DomainRestrictionsRequest;
import org.docshare.sharing.dto.request.VisibilityRequest;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.exception.AccessForbiddenException;
import org.docshare.sharing.exception.UnauthenticatedException;
import org.docshare.sharing.security.IdentityContextProvider;
import org.docshare.sharing.service.PermissionService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * REST controller for reading and changing the sharing configuration of documents
 */
@Slf4j
@RestController
@RequestMapping(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_PERMISSIONS)
@RequiredArgsConstructor
@Tag(name = "Permissions", description = "Document visibility and sharing permissions")
public class PermissionController implements IdentityContextProvider {

    private final PermissionService permissionService;
    private final SharingProperties sharingProperties;

    @GetMapping(value = "/{documentId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Get document permissions",
            description = "Returns the sharing configuration of a document, created with default values on first access"
    )
    public Mono<ResponseEntity<PermissionRecord>> getPermissions(@PathVariable String documentId) {
        return permissionService.getPermissions(documentId)
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/{documentId}/visibility", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Set visibility",
            description = "Sets the visibility mode. Switching to public removes all domain and account restrictions"
    )
    public Mono<ResponseEntity<PermissionRecord>> setVisibility(@PathVariable String documentId,
                                                                @Valid @RequestBody VisibilityRequest request) {
        return authorizeActor(documentId, request.actorId())
                .then(Mono.defer(() -> permissionService.setVisibility(documentId, request.visibility(), request.actorId())))
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/{documentId}/domains", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Restrict to domains",
            description = "Replaces the domain allow-list and makes the document restricted. Fails with 400 on an empty list"
    )
    public Mono<ResponseEntity<PermissionRecord>> setDomainRestrictions(@PathVariable String documentId,
                                                                        @Valid @RequestBody DomainRestrictionsRequest request) {
        return authorizeActor(documentId, request.actorId())
                .then(Mono.defer(() -> permissionService.setDomainRestrictions(documentId, request.domains(), request.actorId())))
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/{documentId}/accounts", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Share with accounts",
            description = "Replaces the account allow-list, makes the document account-shared and records the change in the audit trail. Fails with 400 on an empty list"
    )
    public Mono<ResponseEntity<PermissionRecord>> setAccountPermissions(@PathVariable String documentId,
                                                                        @Valid @RequestBody AccountPermissionsRequest request) {
        return authorizeActor(documentId, request.actorId())
                .then(Mono.defer(() -> permissionService.setAccountPermissions(documentId, request.accounts(), request.actorId())))
                .map(ResponseEntity::ok);
    }

    @DeleteMapping(value = "/{documentId}/accounts/{accountId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Remove an account",
            description = "Removes one account from the allow-list. Unknown accounts leave the document unchanged"
    )
    public Mono<ResponseEntity<PermissionRecord>> removeAccountPermission(@PathVariable String documentId,
                                                                          @PathVariable String accountId,
                                                                          @RequestBody(required = false) ActorRequest request) {
        String actorId = request == null ? null : request.actorId();
        return authorizeActor(documentId, actorId)
                .then(Mono.defer(() -> permissionService.removeAccountPermission(documentId, accountId, actorId)))
                .map(ResponseEntity::ok);
    }

    @DeleteMapping(value = "/{documentId}")
    @Operation(
            summary = "Invalidate document permissions",
            description = "Drops the sharing configuration of a deleted document. Administrators only"
    )
    public Mono<ResponseEntity<Void>> invalidate(@PathVariable String documentId) {
        return getConnectedIdentity()
                .flatMap(identity -> {
                    if (identity.isEmpty()) {
                        return Mono.error(new UnauthenticatedException());
                    }
                    if (!identity.get().hasRole(sharingProperties.getAdminRole())) {
                        return Mono.error(new AccessForbiddenException(documentId, identity.get().id()));
                    }
                    log.info("User {} invalidating permissions of document {}", identity.get().id(), documentId);
                    return permissionService.invalidate(documentId);
                })
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    /**
     * Mutations require an authenticated caller acting under its own id.
     */
    private Mono<Void> authorizeActor(String documentId, String actorId) {
        return getConnectedIdentity()
                .flatMap(identity -> {
                    if (identity.isEmpty()) {
                        return Mono.error(new UnauthenticatedException());
                    }
                    String userId = identity.get().id();
                    if (actorId != null && !actorId.isBlank() && !actorId.trim().equals(userId)) {
                        log.warn("User {} tried to change permissions of document {} as {}", userId, documentId, actorId);
                        return Mono.error(new AccessForbiddenException(documentId, userId));
                    }
                    return Mono.empty();
                });
    }
}
