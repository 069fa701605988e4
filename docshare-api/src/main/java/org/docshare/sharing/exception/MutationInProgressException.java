package org.docshare.sharing.exception;

public class MutationInProgressException extends AbstractDocShareException {

    public MutationInProgressException(String documentId) {
        super("A permission update is already pending for document " + documentId);
    }

    @Override
    public String getError() {
        return DocShareException.MUTATION_IN_PROGRESS;
    }
}
