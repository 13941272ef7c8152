package com.libragraph.plotstore.core.storage.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.libragraph.plotstore.core.storage.StorageException;
import com.libragraph.plotstore.core.storage.ValidationException;
import com.libragraph.plotstore.util.ImageIds;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * MetadataRepository backed by a single JSON document, GUID → record.
 *
 * <p>The document is loaded once; reads are served from an immutable snapshot.
 * Each mutation copies the snapshot, writes the whole document (temp file, fsync,
 * atomic rename) and only then publishes the new snapshot, so a failed write leaves
 * both disk and memory unchanged.
 *
 * <p>A document that does not parse, or whose top level is not an object, is copied
 * aside to {@code {name}.corrupt-{epochMillis}} and storage starts empty; see
 * {@link #recoveryNotice()}. Individual malformed entries are skipped.
 */
public class JsonMetadataRepository implements MetadataRepository {

    private static final Logger log = Logger.getLogger(JsonMetadataRepository.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final BlobTimestamps blobTimestamps;
    private final ReentrantLock lock = new ReentrantLock();
    private final String recoveryNotice;

    private volatile Map<String, ImageMetadata> records;

    public JsonMetadataRepository(Path file, ObjectMapper mapper) {
        this(file, mapper, BlobTimestamps.NONE);
    }

    public JsonMetadataRepository(Path file, ObjectMapper mapper, BlobTimestamps blobTimestamps) {
        this.file = file.toAbsolutePath().normalize();
        this.mapper = mapper;
        this.writer = mapper.writerWithDefaultPrettyPrinter();
        this.blobTimestamps = Objects.requireNonNull(blobTimestamps, "blobTimestamps cannot be null");
        try {
            Files.createDirectories(this.file.getParent());
        } catch (IOException e) {
            throw new StorageException("Failed to create metadata directory: " + this.file.getParent(), e);
        }

        Loaded loaded = load();
        this.records = Collections.unmodifiableMap(loaded.records());
        this.recoveryNotice = loaded.notice();
    }

    public Path file() {
        return file;
    }

    // -- loading --

    private record Loaded(Map<String, ImageMetadata> records, String notice) {
    }

    private Loaded load() {
        if (!Files.exists(file)) {
            log.debugf("No metadata document at %s, starting empty", file);
            return new Loaded(new LinkedHashMap<>(), null);
        }

        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new StorageException("Failed to read metadata document: " + file, e);
        }

        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            return recoverFromCorruption("unparsable JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new StorageException("Failed to read metadata document: " + file, e);
        }
        if (root == null || root.isMissingNode()) {
            return recoverFromCorruption("document is empty");
        }
        if (!root.isObject()) {
            return recoverFromCorruption("expected a JSON object, found " + root.getNodeType());
        }

        Map<String, ImageMetadata> loaded = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String guid = field.getKey();
            if (!ImageIds.isCanonical(guid)) {
                log.warnf("Skipping metadata entry with malformed GUID '%s'", guid);
                continue;
            }
            try {
                MetadataEntry entry = mapper.treeToValue(field.getValue(), MetadataEntry.class);
                loaded.put(guid, entry.toRecord(guid));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warnf("Skipping malformed metadata entry %s: %s", guid, e.getMessage());
            }
        }
        log.infof("Loaded %d metadata records from %s", loaded.size(), file);
        return new Loaded(loaded, null);
    }

    private Loaded recoverFromCorruption(String reason) {
        Path preserved = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        String notice;
        try {
            Files.copy(file, preserved);
            notice = "metadata document was corrupt (" + reason + "); original kept at " + preserved.getFileName();
            log.warnf("Metadata document %s is corrupt (%s), starting empty. Original kept at %s",
                    file, reason, preserved);
        } catch (IOException e) {
            notice = "metadata document was corrupt (" + reason + ") and could not be preserved";
            log.errorf(e, "Metadata document %s is corrupt (%s) and could not be preserved, starting empty",
                    file, reason);
        }
        return new Loaded(new LinkedHashMap<>(), notice);
    }

    // -- reads --

    @Override
    public Optional<ImageMetadata> get(String guid) {
        return guid == null ? Optional.empty() : Optional.ofNullable(records.get(guid));
    }

    @Override
    public boolean exists(String guid) {
        return guid != null && records.containsKey(guid);
    }

    @Override
    public List<String> listAll(String group) {
        return listRecords(group).stream()
                .map(ImageMetadata::guid)
                .toList();
    }

    @Override
    public List<ImageMetadata> listRecords(String group) {
        return records.values().stream()
                .filter(r -> r.inScope(group))
                .sorted(Comparator.comparing(ImageMetadata::guid))
                .toList();
    }

    @Override
    public List<ImageMetadata> filterByAge(int ageDays, String group) {
        if (ageDays < 0) {
            throw new ValidationException("ageDays must be >= 0, got: " + ageDays);
        }
        Instant cutoff = Instant.now().minus(Duration.ofDays(ageDays));
        return listRecords(group).stream()
                .filter(r -> ageOf(r).map(t -> t.isBefore(cutoff)).orElse(false))
                .toList();
    }

    private Optional<Instant> ageOf(ImageMetadata record) {
        Optional<Instant> created = record.createdInstant();
        if (created.isPresent()) {
            return created;
        }
        return blobTimestamps.lastModified(record.guid(), record.format());
    }

    @Override
    public Optional<String> recoveryNotice() {
        return Optional.ofNullable(recoveryNotice);
    }

    // -- mutations --

    @Override
    public void save(ImageMetadata record) {
        if (!ImageIds.isCanonical(record.guid())) {
            throw new ValidationException("Invalid GUID format: " + record.guid());
        }
        lock.lock();
        try {
            Map<String, ImageMetadata> next = new LinkedHashMap<>(records);
            next.put(record.guid(), record);
            commit(next);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ImageMetadata> update(String guid, UnaryOperator<ImageMetadata> change) {
        lock.lock();
        try {
            ImageMetadata current = records.get(guid);
            if (current == null) {
                return Optional.empty();
            }
            ImageMetadata changed = Objects.requireNonNull(change.apply(current), "change returned null");
            if (!guid.equals(changed.guid())) {
                throw new IllegalArgumentException("update must not change the GUID: " + guid
                        + " -> " + changed.guid());
            }
            if (!changed.equals(current)) {
                Map<String, ImageMetadata> next = new LinkedHashMap<>(records);
                next.put(guid, changed);
                commit(next);
            }
            return Optional.of(changed);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String guid) {
        lock.lock();
        try {
            if (guid == null || !records.containsKey(guid)) {
                return false;
            }
            Map<String, ImageMetadata> next = new LinkedHashMap<>(records);
            next.remove(guid);
            commit(next);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void commit(Map<String, ImageMetadata> next) {
        persist(next);
        records = Collections.unmodifiableMap(next);
    }

    private void persist(Map<String, ImageMetadata> snapshot) {
        Map<String, MetadataEntry> document = new TreeMap<>();
        snapshot.forEach((guid, record) -> document.put(guid, MetadataEntry.from(record)));

        Path temp = null;
        try {
            byte[] json = writer.writeValueAsBytes(document);
            temp = Files.createTempFile(file.getParent(), "." + file.getFileName() + ".", ".tmp");
            try (FileChannel out = FileChannel.open(temp,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(json);
                while (buf.hasRemaining()) {
                    out.write(buf);
                }
                out.force(true);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debugf("Atomic move not supported for %s, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
            log.debugf("Metadata saved (%d records)", snapshot.size());
        } catch (IOException e) {
            throw new StorageException("Failed to write metadata document: " + file, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warnf("Failed to remove temp file %s: %s", temp, e.getMessage());
                }
            }
        }
    }
}
