package com.libragraph.plotstore.core.storage;

import com.libragraph.plotstore.types.ImageFormat;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for rendered images: GUID-addressed blobs with per-group access control,
 * human-readable aliases and age-based purging.
 *
 * <p>Groups are opaque tokens supplied by the caller's authentication layer. A null
 * group on a stored image means public; otherwise reads and writes require an exact
 * match. Identifiers accepted by the read/delete operations are either a GUID or an
 * alias.
 */
public interface ImageStorage {

    /**
     * Stores an image under a new random GUID.
     *
     * @return the GUID
     * @throws StorageException on I/O errors; no orphaned blob is left behind
     */
    String saveImage(byte[] data, ImageFormat format, String group);

    /**
     * Retrieves an image by GUID or alias.
     *
     * @return empty if nothing is stored under {@code identifier} for this caller
     * @throws PermissionDeniedException if the image belongs to another group
     */
    Optional<StoredImage> getImage(String identifier, String group);

    /**
     * Deletes an image, its metadata and its alias.
     *
     * @return false if nothing was stored under {@code identifier}
     * @throws PermissionDeniedException if the image belongs to another group
     */
    boolean deleteImage(String identifier, String group);

    /**
     * GUIDs of the images owned by {@code group}, or of all images when it is null. Sorted.
     */
    List<String> listImages(String group);

    /**
     * GUIDs of the images stored without a group. Sorted.
     */
    List<String> listPublicImages();

    /**
     * True when the image exists, has its bytes on disk, and is readable from {@code group}.
     */
    boolean exists(String identifier, String group);

    /**
     * Deletes images older than {@code ageDays} ({@code 0} = all) in scope, then sweeps
     * orphaned records and blobs under the same filter.
     *
     * @return number of images, records and blobs removed
     * @throws ValidationException if {@code ageDays} is negative
     * @throws StorageException if the purge had to stop part way
     */
    int purge(int ageDays, String group);

    /**
     * Resolves a GUID or alias to a GUID. GUIDs are returned unchanged.
     */
    Optional<String> resolveIdentifier(String identifier, String group);

    /**
     * @throws ValidationException if the alias or GUID is malformed
     * @throws AliasAlreadyExistsException if the alias is taken in this group
     * @throws UnknownImageException if the GUID has no record
     * @throws PermissionDeniedException if the image belongs to another group
     */
    void registerAlias(String alias, String guid, String group);

    boolean unregisterAlias(String alias, String group);

    Optional<String> getAlias(String guid);

    Map<String, String> listAliases(String group);
}
