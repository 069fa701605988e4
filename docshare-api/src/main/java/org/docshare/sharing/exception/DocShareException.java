package org.docshare.sharing.exception;

public interface DocShareException {

    String ACCESS_FORBIDDEN = "Forbidden";
    String DOCUMENT_NOT_FOUND = "DocumentNotFound";
    String MUTATION_IN_PROGRESS = "MutationInProgress";
    String TRANSIENT_IO = "TransientIOFailure";
    String UNAUTHENTICATED = "Unauthenticated";
    String VALIDATION = "ValidationError";
}
