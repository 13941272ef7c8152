package com.libragraph.plotstore.core.storage;

import com.libragraph.plotstore.types.BlobKey;

public class BlobAlreadyExistsException extends StorageException {

    public BlobAlreadyExistsException(BlobKey key) {
        super("Blob already exists: " + key);
    }
}
