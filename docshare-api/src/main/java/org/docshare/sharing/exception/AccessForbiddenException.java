package org.docshare.sharing.exception;

public class AccessForbiddenException extends AbstractDocShareException {

    public AccessForbiddenException(String documentId, String userId) {
        super("User " + userId + " is not allowed to access document " + documentId);
    }

    @Override
    public String getError() {
        return DocShareException.ACCESS_FORBIDDEN;
    }
}
