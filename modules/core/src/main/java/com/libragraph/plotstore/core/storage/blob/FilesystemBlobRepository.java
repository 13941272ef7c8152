package com.libragraph.plotstore.core.storage.blob;

import com.libragraph.plotstore.core.storage.BlobAlreadyExistsException;
import com.libragraph.plotstore.core.storage.BlobNotFoundException;
import com.libragraph.plotstore.core.storage.StorageException;
import com.libragraph.plotstore.core.storage.ValidationException;
import com.libragraph.plotstore.types.BlobKey;
import com.libragraph.plotstore.types.ImageFormat;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Filesystem-backed BlobRepository.
 *
 * <p>Layout: {@code {root}/{guid}.{extension}}, flat.
 * Writes go to a hidden temp file in the same directory and are renamed into place,
 * so readers only ever see complete blobs.
 */
public class FilesystemBlobRepository implements BlobRepository {

    private static final Logger log = Logger.getLogger(FilesystemBlobRepository.class);

    private final Path root;

    public FilesystemBlobRepository(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageException("Failed to create blob directory: " + this.root, e);
        }
    }

    public Path root() {
        return root;
    }

    private Path resolvePath(BlobKey key) {
        return root.resolve(key.fileName());
    }

    private static BlobKey key(String guid, ImageFormat format) {
        try {
            return BlobKey.of(guid, format);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }

    @Override
    public void save(String guid, byte[] data, ImageFormat format) {
        BlobKey key = key(guid, format);
        Path target = resolvePath(key);
        if (Files.exists(target)) {
            throw new BlobAlreadyExistsException(key);
        }

        Path temp = null;
        try {
            temp = Files.createTempFile(root, "." + guid + ".", ".tmp");
            try (FileChannel out = FileChannel.open(temp,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(data);
                while (buf.hasRemaining()) {
                    out.write(buf);
                }
                out.force(true);
            }
            moveIntoPlace(temp, target);
            temp = null;
            log.debugf("Blob written: %s (%d bytes)", key, data.length);
        } catch (IOException e) {
            throw new StorageException("Failed to write blob: " + key, e);
        } finally {
            if (temp != null) {
                discardTemp(temp);
            }
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debugf("Atomic move not supported for %s, falling back to plain move", target);
            Files.move(temp, target);
        }
    }

    private static void discardTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warnf("Failed to remove temp file %s: %s", temp, e.getMessage());
        }
    }

    @Override
    public byte[] get(String guid, ImageFormat format) {
        BlobKey key = key(guid, format);
        try {
            return Files.readAllBytes(resolvePath(key));
        } catch (NoSuchFileException e) {
            throw new BlobNotFoundException(key);
        } catch (IOException e) {
            throw new StorageException("Failed to read blob: " + key, e);
        }
    }

    @Override
    public boolean exists(String guid) {
        return getFormat(guid).isPresent();
    }

    @Override
    public boolean exists(String guid, ImageFormat format) {
        return Files.isRegularFile(resolvePath(key(guid, format)));
    }

    @Override
    public boolean delete(String guid) {
        boolean deleted = false;
        for (ImageFormat format : ImageFormat.values()) {
            deleted |= delete(guid, format);
        }
        return deleted;
    }

    @Override
    public boolean delete(String guid, ImageFormat format) {
        BlobKey key = key(guid, format);
        try {
            boolean deleted = Files.deleteIfExists(resolvePath(key));
            if (deleted) {
                log.debugf("Blob deleted: %s", key);
            }
            return deleted;
        } catch (IOException e) {
            throw new StorageException("Failed to delete blob: " + key, e);
        }
    }

    @Override
    public Set<String> listAll() {
        Set<String> guids = new HashSet<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                if (!Files.isRegularFile(entry)) {
                    continue;
                }
                BlobKey.tryParse(entry.getFileName().toString())
                        .ifPresent(k -> guids.add(k.guid()));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list blobs in " + root, e);
        }
        return guids;
    }

    @Override
    public Optional<ImageFormat> getFormat(String guid) {
        for (ImageFormat format : ImageFormat.values()) {
            if (exists(guid, format)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Instant> lastModified(String guid, ImageFormat format) {
        Path path = resolvePath(key(guid, format));
        try {
            return Optional.of(Files.getLastModifiedTime(path).toInstant());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to stat blob: " + path.getFileName(), e);
        }
    }
}
