package com.libragraph.plotstore.core.storage.backend;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings handed to a {@link BackendFactory}.
 *
 * @param root         directory holding the blobs
 * @param metadataFile explicit metadata document location; backends that keep
 *                     metadata next to the blobs ignore it
 */
public record StorageSettings(Path root, Optional<Path> metadataFile) {

    public StorageSettings {
        Objects.requireNonNull(root, "root cannot be null");
        metadataFile = metadataFile == null ? Optional.empty() : metadataFile;
    }

    public static StorageSettings at(Path root) {
        return new StorageSettings(root, Optional.empty());
    }
}
