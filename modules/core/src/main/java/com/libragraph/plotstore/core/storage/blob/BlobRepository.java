package com.libragraph.plotstore.core.storage.blob;

import com.libragraph.plotstore.types.ImageFormat;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Raw byte storage for rendered images, keyed by GUID and format.
 *
 * <p>Knows nothing about groups or aliases. GUIDs must be canonical; anything else
 * is refused with {@link com.libragraph.plotstore.core.storage.ValidationException}.
 */
public interface BlobRepository {

    /**
     * Stores a blob. Write-once: an existing key is refused.
     * A failed write never leaves a readable partial blob behind.
     *
     * @throws com.libragraph.plotstore.core.storage.BlobAlreadyExistsException if the key exists
     * @throws com.libragraph.plotstore.core.storage.StorageException on I/O errors
     */
    void save(String guid, byte[] data, ImageFormat format);

    /**
     * Reads a blob.
     *
     * @throws com.libragraph.plotstore.core.storage.BlobNotFoundException if the blob does not exist
     * @throws com.libragraph.plotstore.core.storage.StorageException on I/O errors
     */
    byte[] get(String guid, ImageFormat format);

    /**
     * Checks whether a blob exists in any supported format.
     */
    boolean exists(String guid);

    boolean exists(String guid, ImageFormat format);

    /**
     * Deletes the blob in every format it exists in.
     *
     * @return true if anything was deleted
     */
    boolean delete(String guid);

    /**
     * @return true if the blob existed and was deleted
     */
    boolean delete(String guid, ImageFormat format);

    /**
     * Lists the GUIDs of all stored blobs. Files that are not
     * {@code {guid}.{supported-extension}} are ignored.
     */
    Set<String> listAll();

    /**
     * Detects a blob's format from what is on disk, probing in
     * {@link ImageFormat} declaration order.
     */
    Optional<ImageFormat> getFormat(String guid);

    /**
     * Last modification time of the blob, if it exists.
     */
    Optional<Instant> lastModified(String guid, ImageFormat format);
}
