package io.jamsession.server.spi;

/**
 * Transient conflict that is safe to retry: a lost unique-constraint race, a busy or locked database,
 * or a serialization failure. Nothing was changed by the failed attempt.
 */
public class StoreConflictException extends StoreException {

    public StoreConflictException(String message) {
        super(message);
    }

    public StoreConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
