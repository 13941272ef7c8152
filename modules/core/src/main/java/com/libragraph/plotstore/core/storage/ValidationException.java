package com.libragraph.plotstore.core.storage;

/**
 * Malformed input to a storage operation: bad alias, bad GUID, negative purge age.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
