package org.docshare.sharing.controller.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.docshare.sharing.config.RestApiVersion;
import org.docshare.sharing.dto.response.AccessDecision;
import org.docshare.sharing.dto.response.DocumentInfo;
import org.docshare.sharing.service.DocumentAccessService;
import org.docshare.sharing.security.IdentityContextProvider;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_DOCUMENTS)
@RequiredArgsConstructor
@Tag(name = "Documents", description = "Document visibility for the connected user")
public class DocumentAccessController implements IdentityContextProvider {

    private final DocumentAccessService documentAccessService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "List visible documents",
            description = "Lists the documents the connected user may access, with the granted level"
    )
    public Flux<DocumentInfo> listDocuments() {
        return getConnectedIdentity()
                .flatMapMany(identity -> documentAccessService.listVisibleDocuments(identity.orElse(null)));
    }

    @GetMapping(value = "/{documentId}/access", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Check access",
            description = "Returns the access decision of the connected user for a document. Fails with 401, 403 or 404"
    )
    public Mono<ResponseEntity<AccessDecision>> checkAccess(@PathVariable String documentId) {
        return getConnectedIdentity()
                .flatMap(identity -> documentAccessService.checkAccess(documentId, identity.orElse(null)))
                .map(ResponseEntity::ok);
    }
}
