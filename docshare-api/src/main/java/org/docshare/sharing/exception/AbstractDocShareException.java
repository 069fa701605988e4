package org.docshare.sharing.exception;

public abstract class AbstractDocShareException extends RuntimeException {

    public AbstractDocShareException(String message) {
        super(message);
    }

    public AbstractDocShareException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getError();

}
