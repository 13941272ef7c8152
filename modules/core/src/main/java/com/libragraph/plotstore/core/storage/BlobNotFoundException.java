package com.libragraph.plotstore.core.storage;

import com.libragraph.plotstore.types.BlobKey;

/**
 * Thrown when a read targets a blob that does not exist.
 */
public class BlobNotFoundException extends StorageException {

    private final BlobKey key;

    public BlobNotFoundException(BlobKey key) {
        super("Blob not found: " + key);
        this.key = key;
    }

    public BlobKey key() {
        return key;
    }
}
