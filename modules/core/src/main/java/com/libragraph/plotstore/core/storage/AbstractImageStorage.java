package com.libragraph.plotstore.core.storage;

import com.libragraph.plotstore.core.storage.alias.AliasIndex;
import com.libragraph.plotstore.core.storage.blob.BlobRepository;
import com.libragraph.plotstore.core.storage.metadata.ImageMetadata;
import com.libragraph.plotstore.core.storage.metadata.MetadataRepository;
import com.libragraph.plotstore.types.ImageFormat;
import com.libragraph.plotstore.util.ImageIds;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Base class for {@link ImageStorage} backends. Provides:
 * <ul>
 *   <li>blob-then-metadata saves with cleanup of the blob when the metadata write fails</li>
 *   <li>GUID-or-alias resolution and group access checks</li>
 *   <li>purge with orphan sweeps, safe against concurrent saves</li>
 * </ul>
 * Subclasses decide where the repositories live and may serialize mutations by
 * overriding {@link #mutation(Supplier)}.
 */
public abstract class AbstractImageStorage implements ImageStorageBackend {

    protected final Logger log = Logger.getLogger(getClass());

    private final BlobRepository blobs;
    private final MetadataRepository metadata;
    private final AliasIndex aliases;
    private final Path root;

    /** GUIDs whose blob may be on disk before their metadata record is. */
    private final Set<String> pendingSaves = ConcurrentHashMap.newKeySet();

    protected AbstractImageStorage(BlobRepository blobs, MetadataRepository metadata, Path root) {
        this.blobs = Objects.requireNonNull(blobs, "blobs cannot be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata cannot be null");
        this.root = root;
        this.aliases = new AliasIndex(metadata);
        log.infof("%s storage initialized at %s (%d images)",
                backendName(), root, metadata.listAll().size());
    }

    /**
     * Runs a mutating operation: the metadata step of a save, a delete, a purge or an
     * alias change. Blob writes of a save run outside it. The default relies on the
     * repositories' own locking.
     */
    protected <T> T mutation(Supplier<T> action) {
        return action.get();
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public Optional<String> recoveryNotice() {
        return metadata.recoveryNotice();
    }

    // -- save --

    @Override
    public String saveImage(byte[] data, ImageFormat format, String group) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(format, "format cannot be null");
        String guid = ImageIds.newId();
        pendingSaves.add(guid);
        try {
            // write-once blob under a fresh GUID, so only the record goes through mutation()
            blobs.save(guid, data, format);
            try {
                mutation(() -> {
                    metadata.save(ImageMetadata.created(guid, format, data.length, group, Instant.now()));
                    return null;
                });
            } catch (RuntimeException e) {
                log.errorf("Failed to save metadata for %s, removing blob: %s", guid, e.getMessage());
                discardBlob(guid, format, e);
                throw e;
            }
            log.infof("Image saved: %s (format=%s, size=%d, group=%s)",
                    guid, format.extension(), data.length, group);
            return guid;
        } finally {
            pendingSaves.remove(guid);
        }
    }

    private void discardBlob(String guid, ImageFormat format, RuntimeException cause) {
        try {
            blobs.delete(guid, format);
        } catch (RuntimeException cleanup) {
            cause.addSuppressed(cleanup);
            log.warnf("Could not remove orphaned blob %s: %s", guid, cleanup.getMessage());
        }
    }

    // -- reads --

    @Override
    public Optional<StoredImage> getImage(String identifier, String group) {
        Optional<ImageMetadata> record = resolveRecord(identifier, group);
        if (record.isEmpty()) {
            log.debugf("Image not found: %s (group=%s)", identifier, group);
            return Optional.empty();
        }
        Optional<StoredImage> image = readBlob(record.get());
        image.ifPresent(i -> log.debugf("Image retrieved: %s (format=%s, size=%d, group=%s)",
                i.guid(), i.format().extension(), i.size(), group));
        return image;
    }

    private Optional<StoredImage> readBlob(ImageMetadata record) {
        String guid = record.guid();
        try {
            return Optional.of(new StoredImage(guid, blobs.get(guid, record.format()), record.format()));
        } catch (BlobNotFoundException e) {
            Optional<ImageFormat> detected = blobs.getFormat(guid);
            if (detected.isEmpty()) {
                log.warnf("Image %s has metadata but no blob", guid);
                return Optional.empty();
            }
            log.warnf("Image %s recorded as %s but stored as %s",
                    guid, record.format().extension(), detected.get().extension());
            try {
                return Optional.of(new StoredImage(guid, blobs.get(guid, detected.get()), detected.get()));
            } catch (BlobNotFoundException gone) {
                return Optional.empty();
            }
        }
    }

    @Override
    public boolean exists(String identifier, String group) {
        return aliases.resolveIdentifier(identifier, group)
                .flatMap(metadata::get)
                .filter(r -> r.accessibleFrom(group))
                .map(r -> blobs.exists(r.guid()))
                .orElse(false);
    }

    @Override
    public List<String> listImages(String group) {
        List<String> guids = metadata.listAll(group);
        log.debugf("Listed %d images (group=%s)", guids.size(), group);
        return guids;
    }

    @Override
    public List<String> listPublicImages() {
        return metadata.listRecords(null).stream()
                .filter(r -> r.group() == null)
                .map(ImageMetadata::guid)
                .toList();
    }

    /**
     * Resolves an identifier to its record and checks the caller may access it.
     * Blobs without a record are not served; they wait for {@link #purge}.
     */
    private Optional<ImageMetadata> resolveRecord(String identifier, String group) {
        Optional<String> guid = aliases.resolveIdentifier(identifier, group);
        if (guid.isEmpty()) {
            if (identifier != null && aliases.isClaimedByOtherGroup(identifier, group)) {
                log.warnf("Alias '%s' requested from group '%s' belongs to another group", identifier, group);
                throw new PermissionDeniedException(identifier, group);
            }
            return Optional.empty();
        }
        Optional<ImageMetadata> record = metadata.get(guid.get());
        if (record.isPresent() && !record.get().accessibleFrom(group)) {
            log.warnf("Group mismatch for %s: requested=%s, stored=%s",
                    identifier, group, record.get().group());
            throw new PermissionDeniedException(identifier, group);
        }
        return record;
    }

    // -- delete --

    @Override
    public boolean deleteImage(String identifier, String group) {
        return mutation(() -> {
            Optional<ImageMetadata> record = resolveRecord(identifier, group);
            if (record.isEmpty()) {
                return false;
            }
            boolean removed = removeImage(record.get());
            log.infof("Image deleted: %s (group=%s)", record.get().guid(), group);
            return removed;
        });
    }

    /** Blob first, then record and alias; a crash in between leaves an orphaned record for purge. */
    private boolean removeImage(ImageMetadata record) {
        String guid = record.guid();
        boolean blobDeleted = blobs.delete(guid);
        boolean recordDeleted = aliases.evict(guid, () -> metadata.delete(guid));
        return blobDeleted || recordDeleted;
    }

    // -- purge --

    @Override
    public int purge(int ageDays, String group) {
        if (ageDays < 0) {
            throw new ValidationException("ageDays must be >= 0, got: " + ageDays);
        }
        return mutation(() -> doPurge(ageDays, group));
    }

    private int doPurge(int ageDays, String group) {
        log.infof("Starting purge (ageDays=%d, group=%s)", ageDays, group);
        Instant cutoff = ageDays == 0 ? null : Instant.now().minus(Duration.ofDays(ageDays));
        int removed = 0;
        try {
            List<ImageMetadata> expired = ageDays == 0
                    ? metadata.listRecords(group)
                    : metadata.filterByAge(ageDays, group);
            Set<String> handled = new HashSet<>();
            for (ImageMetadata record : expired) {
                handled.add(record.guid());
                if (removeImage(record)) {
                    removed++;
                    log.debugf("Purged image %s", record.guid());
                }
            }

            // Records are listed before their blobs are checked: a record is only written
            // after its blob, so a missing blob here is a real orphan.
            for (ImageMetadata record : metadata.listRecords(group)) {
                String guid = record.guid();
                if (handled.contains(guid) || blobs.exists(guid) || isYoungerThan(record, cutoff)) {
                    continue;
                }
                if (aliases.evict(guid, () -> metadata.delete(guid))) {
                    removed++;
                    log.debugf("Removed orphaned record %s", guid);
                }
            }

            // Orphaned blobs have no owner, so only an unscoped purge may take them.
            if (group == null) {
                for (String guid : blobs.listAll()) {
                    if (pendingSaves.contains(guid) || metadata.exists(guid)) {
                        continue;
                    }
                    Optional<ImageFormat> format = blobs.getFormat(guid);
                    if (format.isEmpty() || !isOlderThan(blobs.lastModified(guid, format.get()), cutoff)) {
                        continue;
                    }
                    if (blobs.delete(guid)) {
                        removed++;
                        log.debugf("Removed orphaned blob %s", guid);
                    }
                }
            }
        } catch (RuntimeException e) {
            log.errorf(e, "Purge aborted after %d deletions (ageDays=%d, group=%s)", removed, ageDays, group);
            throw new StorageException("Purge aborted after " + removed + " deletions", e);
        }
        log.infof("Purge completed: %d removed (ageDays=%d, group=%s)", removed, ageDays, group);
        return removed;
    }

    /** Records with an unknown creation time count as old. */
    private static boolean isYoungerThan(ImageMetadata record, Instant cutoff) {
        return cutoff != null && record.createdInstant().map(t -> !t.isBefore(cutoff)).orElse(false);
    }

    private static boolean isOlderThan(Optional<Instant> timestamp, Instant cutoff) {
        return cutoff == null || timestamp.map(t -> t.isBefore(cutoff)).orElse(false);
    }

    // -- aliases --

    @Override
    public Optional<String> resolveIdentifier(String identifier, String group) {
        return aliases.resolveIdentifier(identifier, group);
    }

    @Override
    public void registerAlias(String alias, String guid, String group) {
        mutation(() -> {
            aliases.registerAlias(alias, guid, group);
            return null;
        });
    }

    @Override
    public boolean unregisterAlias(String alias, String group) {
        return mutation(() -> aliases.unregisterAlias(alias, group));
    }

    @Override
    public Optional<String> getAlias(String guid) {
        return aliases.getAlias(guid);
    }

    @Override
    public Map<String, String> listAliases(String group) {
        return aliases.listAliases(group);
    }
}
