package org.docshare.sharing.exception;

public class PermissionValidationException extends AbstractDocShareException {

    public PermissionValidationException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return DocShareException.VALIDATION;
    }
}
