package org.docshare.sharing.exception;

public class UnauthenticatedException extends AbstractDocShareException {

    private static final String MISSING_IDENTITY = "Missing user credentials";

    public UnauthenticatedException() {
        super(MISSING_IDENTITY);
    }

    @Override
    public String getError() {
        return DocShareException.UNAUTHENTICATED;
    }
}
