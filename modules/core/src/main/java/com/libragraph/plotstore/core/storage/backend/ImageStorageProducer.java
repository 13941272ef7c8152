package com.libragraph.plotstore.core.storage.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.plotstore.core.storage.ImageStorageBackend;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Optional;

@ApplicationScoped
public class ImageStorageProducer {

    private static final Logger log = Logger.getLogger(ImageStorageProducer.class);

    @ConfigProperty(name = "plotstore.storage.backend", defaultValue = "file")
    String backend;

    @ConfigProperty(name = "plotstore.storage.root", defaultValue = "data/storage")
    String root;

    @ConfigProperty(name = "plotstore.storage.metadata-file")
    Optional<String> metadataFile;

    @Inject
    ObjectMapper mapper;

    @Produces
    @Singleton
    public ImageStorageBackend imageStorage() {
        StorageSettings settings = new StorageSettings(Path.of(root), metadataFile.map(Path::of));
        ImageStorageBackend storage = BackendRegistry.defaults(mapper).create(backend, settings);
        log.infof("Image storage ready: backend=%s, root=%s", storage.backendName(), storage.root());
        return storage;
    }
}
