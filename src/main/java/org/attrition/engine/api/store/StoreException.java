package org.attrition.engine.api.store;

/**
 * Unchecked wrapper for storage failures. Callers surface it as {@code DB_ERROR}
 * without exposing the underlying message.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
