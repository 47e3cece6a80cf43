package io.jamsession.server.spi;

/**
 * Failure reported by a {@link JamStore} implementation.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
