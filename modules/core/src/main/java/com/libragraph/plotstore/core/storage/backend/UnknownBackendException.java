package com.libragraph.plotstore.core.storage.backend;

import java.util.Collection;

/**
 * Thrown when the configured backend name is not registered.
 */
public class UnknownBackendException extends IllegalArgumentException {

    private final String name;

    public UnknownBackendException(String name, Collection<String> known) {
        super("Unknown storage backend: " + name + " (available: " + String.join(", ", known) + ")");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
