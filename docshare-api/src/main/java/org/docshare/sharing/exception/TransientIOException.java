package org.docshare.sharing.exception;

/**
 * The permission authority could not be reached or failed while processing a mutation.
 * Callers may retry.
 */
public class TransientIOException extends AbstractDocShareException {

    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return DocShareException.TRANSIENT_IO;
    }
}
