package com.libragraph.plotstore.core.storage.backend;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in storage backends, keyed by their configuration name.
 */
public enum BackendKind {
    /** Blobs and metadata in one directory, one storage-wide lock. */
    CONSOLIDATED("file"),
    /** Separate blob and metadata repositories. */
    SPLIT("file_v2");

    private final String configName;

    BackendKind(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Optional<BackendKind> fromName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.configName.equals(name))
                .findFirst();
    }
}
