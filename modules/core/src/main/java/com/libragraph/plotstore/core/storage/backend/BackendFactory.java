package com.libragraph.plotstore.core.storage.backend;

import com.libragraph.plotstore.core.storage.ImageStorageBackend;

@FunctionalInterface
public interface BackendFactory {

    ImageStorageBackend create(StorageSettings settings);
}
