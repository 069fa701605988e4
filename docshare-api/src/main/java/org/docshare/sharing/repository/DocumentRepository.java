package org.docshare.sharing.repository;

import org.docshare.sharing.entity.Document;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read access to the documents of the document subsystem.
 */
public interface DocumentRepository {

    Mono<Document> findById(String documentId);

    Flux<Document> findAll();
}
