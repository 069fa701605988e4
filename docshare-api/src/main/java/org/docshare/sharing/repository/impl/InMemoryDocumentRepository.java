package org.docshare.sharing.repository.impl;

import lombok.extern.slf4j.Slf4j;
import org.docshare.sharing.config.CatalogProperties;
import org.docshare.sharing.config.CatalogProperties.DocumentSeed;
import org.docshare.sharing.entity.Document;
import org.docshare.sharing.repository.DocumentRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document catalog loaded from configuration. Stands in for the document subsystem.
 */
@Slf4j
@Repository
public class InMemoryDocumentRepository implements DocumentRepository {

    private final Map<String, Document> documents;

    public InMemoryDocumentRepository(CatalogProperties catalogProperties) {
        Map<String, Document> loaded = new LinkedHashMap<>();
        for (DocumentSeed seed : catalogProperties.getDocuments()) {
            if (seed.getId() == null || seed.getId().isBlank()) {
                throw new IllegalArgumentException("docshare.catalog.documents[].id must not be blank");
            }
            if (loaded.put(seed.getId(), toDocument(seed)) != null) {
                throw new IllegalArgumentException("Duplicate document id in catalog : " + seed.getId());
            }
        }
        this.documents = Collections.unmodifiableMap(loaded);
        log.info("Document catalog loaded with {} documents", documents.size());
    }

    @Override
    public Mono<Document> findById(String documentId) {
        return Mono.justOrEmpty(documents.get(documentId));
    }

    @Override
    public Flux<Document> findAll() {
        return Flux.fromIterable(documents.values());
    }

    private static Document toDocument(DocumentSeed seed) {
        return Document.builder()
                .id(seed.getId())
                .title(seed.getTitle())
                .team(seed.getTeam())
                .ownerId(seed.getOwnerId())
                .requiredRoles(seed.getRequiredRoles())
                .assignedUserIds(seed.getAssignedUserIds())
                .build();
    }
}
