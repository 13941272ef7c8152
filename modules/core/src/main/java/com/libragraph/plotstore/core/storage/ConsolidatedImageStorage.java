package com.libragraph.plotstore.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.plotstore.core.storage.backend.BackendKind;
import com.libragraph.plotstore.core.storage.blob.FilesystemBlobRepository;
import com.libragraph.plotstore.core.storage.metadata.JsonMetadataRepository;

import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The {@code file} backend: blobs and {@code metadata.json} share one directory,
 * and every metadata or alias mutation runs under a single storage-wide lock.
 */
public class ConsolidatedImageStorage extends AbstractImageStorage {

    public static final String METADATA_FILE = "metadata.json";

    private final ReentrantLock mutationLock = new ReentrantLock();

    public ConsolidatedImageStorage(Path root, ObjectMapper mapper) {
        this(new FilesystemBlobRepository(root), mapper);
    }

    ConsolidatedImageStorage(FilesystemBlobRepository blobs, ObjectMapper mapper) {
        super(blobs,
                new JsonMetadataRepository(blobs.root().resolve(METADATA_FILE), mapper, blobs::lastModified),
                blobs.root());
    }

    @Override
    public String backendName() {
        return BackendKind.CONSOLIDATED.configName();
    }

    @Override
    protected <T> T mutation(Supplier<T> action) {
        mutationLock.lock();
        try {
            return action.get();
        } finally {
            mutationLock.unlock();
        }
    }
}
