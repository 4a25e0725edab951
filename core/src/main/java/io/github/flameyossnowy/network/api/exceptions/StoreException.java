package io.github.flameyossnowy.network.api.exceptions;

/**
 * A failure inside a record store (connection, statement, mapping).
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
