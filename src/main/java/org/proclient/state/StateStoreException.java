package org.proclient.state;

/**
 * Thrown when the persisted attachment state cannot be read or written.
 */
public class StateStoreException extends RuntimeException {

    /**
     * Creates a new StateStoreException.
     *
     * @param message description of the failed operation.
     * @param cause   the underlying I/O or parsing failure.
     */
    public StateStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
