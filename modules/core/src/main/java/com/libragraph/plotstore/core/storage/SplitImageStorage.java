package com.libragraph.plotstore.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.plotstore.core.storage.backend.BackendKind;
import com.libragraph.plotstore.core.storage.blob.BlobRepository;
import com.libragraph.plotstore.core.storage.blob.FilesystemBlobRepository;
import com.libragraph.plotstore.core.storage.metadata.JsonMetadataRepository;
import com.libragraph.plotstore.core.storage.metadata.MetadataRepository;

import java.nio.file.Path;

/**
 * The {@code file_v2} backend: a {@link BlobRepository} and a {@link MetadataRepository}
 * composed behind the {@link ImageStorage} contract. Mutations rely on the repositories'
 * own locking.
 */
public class SplitImageStorage extends AbstractImageStorage {

    public SplitImageStorage(BlobRepository blobs, MetadataRepository metadata, Path root) {
        super(blobs, metadata, root);
    }

    /**
     * Filesystem blobs under {@code root} with the metadata document at {@code metadataFile}
     * ({@code root/metadata.json} when null).
     */
    public static SplitImageStorage onFilesystem(Path root, Path metadataFile, ObjectMapper mapper) {
        FilesystemBlobRepository blobs = new FilesystemBlobRepository(root);
        Path document = metadataFile != null
                ? metadataFile
                : blobs.root().resolve(ConsolidatedImageStorage.METADATA_FILE);
        return new SplitImageStorage(blobs,
                new JsonMetadataRepository(document, mapper, blobs::lastModified),
                blobs.root());
    }

    @Override
    public String backendName() {
        return BackendKind.SPLIT.configName();
    }
}
