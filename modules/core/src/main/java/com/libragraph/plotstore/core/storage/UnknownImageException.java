package com.libragraph.plotstore.core.storage;

/**
 * An operation that requires an existing image (alias registration) named a GUID
 * with no metadata record.
 */
public class UnknownImageException extends ValidationException {

    public UnknownImageException(String guid) {
        super("Image not found: " + guid);
    }
}
