package com.example.mythic.persistence;

/**
 * A read or write against the combat store failed. Fatal for the current call.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
