package com.libragraph.plotstore.core.storage.metadata;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable store of {@link ImageMetadata}, one record per GUID.
 *
 * <p>Implementations serialize mutations; each one is a complete
 * read-modify-write of the backing document.
 */
public interface MetadataRepository {

    /**
     * Inserts or replaces the record for {@code record.guid()}.
     *
     * @throws com.libragraph.plotstore.core.storage.StorageException on I/O errors
     */
    void save(ImageMetadata record);

    Optional<ImageMetadata> get(String guid);

    /**
     * Atomically replaces an existing record with {@code change.apply(current)}.
     * The change function runs while the repository is locked and must not call back into it.
     *
     * @return the updated record, or empty if there was no record for {@code guid}
     */
    Optional<ImageMetadata> update(String guid, UnaryOperator<ImageMetadata> change);

    /**
     * @return true if a record existed and was removed
     */
    boolean delete(String guid);

    boolean exists(String guid);

    /**
     * GUIDs of all records, or of the records owned by {@code group} when it is non-null.
     */
    List<String> listAll(String group);

    default List<String> listAll() {
        return listAll(null);
    }

    /**
     * Snapshot of the records in scope; same filtering as {@link #listAll(String)}.
     */
    List<ImageMetadata> listRecords(String group);

    /**
     * Records in scope that were created more than {@code ageDays} days ago.
     * When {@code created_at} is missing or unparsable the blob's modification time is used;
     * records whose age cannot be determined at all are not returned.
     *
     * @throws com.libragraph.plotstore.core.storage.ValidationException if {@code ageDays} is negative
     */
    List<ImageMetadata> filterByAge(int ageDays, String group);

    /**
     * Set when the backing document was found corrupt at startup and storage began
     * from an empty state.
     */
    default Optional<String> recoveryNotice() {
        return Optional.empty();
    }
}
