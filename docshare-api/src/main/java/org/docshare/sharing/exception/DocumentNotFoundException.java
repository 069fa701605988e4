package org.docshare.sharing.exception;

public class DocumentNotFoundException extends AbstractDocShareException {

    private static final String DOCUMENT_NOT_FOUND = "Document not found : ";

    public DocumentNotFoundException(String documentId) {
        super(DOCUMENT_NOT_FOUND + documentId);
    }

    @Override
    public String getError() {
        return DocShareException.DOCUMENT_NOT_FOUND;
    }
}
