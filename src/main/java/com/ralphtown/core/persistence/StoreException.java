package com.ralphtown.core.persistence;

/**
 * Thrown when the session store cannot complete an operation.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
