package com.libragraph.plotstore.core.storage.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.plotstore.core.storage.ConsolidatedImageStorage;
import com.libragraph.plotstore.core.storage.ImageStorageBackend;
import com.libragraph.plotstore.core.storage.SplitImageStorage;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps backend names to factories. Immutable once built.
 */
public final class BackendRegistry {

    private static final Logger log = Logger.getLogger(BackendRegistry.class);

    private final Map<String, BackendFactory> factories;

    private BackendRegistry(Map<String, BackendFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    /**
     * Registry with the built-in {@code file} and {@code file_v2} backends.
     */
    public static BackendRegistry defaults(ObjectMapper mapper) {
        return builder()
                .register(BackendKind.CONSOLIDATED.configName(),
                        settings -> new ConsolidatedImageStorage(settings.root(), mapper))
                .register(BackendKind.SPLIT.configName(),
                        settings -> SplitImageStorage.onFilesystem(
                                settings.root(), settings.metadataFile().orElse(null), mapper))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> names() {
        return factories.keySet();
    }

    /**
     * @throws UnknownBackendException if no backend is registered under {@code name}
     */
    public ImageStorageBackend create(String name, StorageSettings settings) {
        BackendFactory factory = factories.get(name);
        if (factory == null) {
            throw new UnknownBackendException(name, factories.keySet());
        }
        log.infof("Creating storage backend '%s' at %s", name, settings.root());
        return factory.create(settings);
    }

    public static final class Builder {

        private final Map<String, BackendFactory> factories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, BackendFactory factory) {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(factory, "factory cannot be null");
            if (factories.putIfAbsent(name, factory) != null) {
                throw new IllegalStateException("Duplicate storage backend '" + name + "'");
            }
            return this;
        }

        public BackendRegistry build() {
            return new BackendRegistry(factories);
        }
    }
}
