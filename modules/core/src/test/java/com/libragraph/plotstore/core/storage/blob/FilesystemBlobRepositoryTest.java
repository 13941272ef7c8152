package com.libragraph.plotstore.core.storage.blob;

import com.libragraph.plotstore.core.storage.BlobAlreadyExistsException;
import com.libragraph.plotstore.core.storage.BlobNotFoundException;
import com.libragraph.plotstore.core.storage.ValidationException;
import com.libragraph.plotstore.types.ImageFormat;
import com.libragraph.plotstore.util.ImageIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.*;

class FilesystemBlobRepositoryTest {

    @TempDir
    Path root;

    FilesystemBlobRepository blobs;

    @BeforeEach
    void setUp() {
        blobs = new FilesystemBlobRepository(root);
    }

    // --- save / get ---

    @Test
    void saveWritesGuidDotExtension() throws IOException {
        String guid = ImageIds.newId();
        blobs.save(guid, new byte[]{1, 2, 3}, ImageFormat.PNG);

        Path file = root.resolve(guid + ".png");
        assertThat(file).exists();
        assertThat(Files.readAllBytes(file)).containsExactly(1, 2, 3);
        assertThat(blobs.get(guid, ImageFormat.PNG)).containsExactly(1, 2, 3);
    }

    @Test
    void saveLeavesNoTempFiles() throws IOException {
        blobs.save(ImageIds.newId(), new byte[]{9}, ImageFormat.SVG);

        try (var files = Files.list(root)) {
            assertThat(files).allMatch(p -> !p.getFileName().toString().endsWith(".tmp"));
        }
    }

    @Test
    void saveRefusesToOverwrite() {
        String guid = ImageIds.newId();
        blobs.save(guid, new byte[]{1}, ImageFormat.PNG);

        assertThatThrownBy(() -> blobs.save(guid, new byte[]{2}, ImageFormat.PNG))
                .isInstanceOf(BlobAlreadyExistsException.class);
        assertThat(blobs.get(guid, ImageFormat.PNG)).containsExactly(1);
    }

    @Test
    void saveAcceptsEmptyData() {
        String guid = ImageIds.newId();
        blobs.save(guid, new byte[0], ImageFormat.PDF);
        assertThat(blobs.get(guid, ImageFormat.PDF)).isEmpty();
    }

    @Test
    void getMissingThrows() {
        assertThatThrownBy(() -> blobs.get(ImageIds.newId(), ImageFormat.PNG))
                .isInstanceOf(BlobNotFoundException.class);
    }

    @Test
    void malformedGuidIsRejected() {
        assertThatThrownBy(() -> blobs.save("../escape", new byte[]{1}, ImageFormat.PNG))
                .isInstanceOf(ValidationException.class);
    }

    // --- exists / format ---

    @Test
    void formatIsDetectedFromExtension() {
        String guid = ImageIds.newId();
        blobs.save(guid, new byte[]{1}, ImageFormat.JPEG);

        assertThat(blobs.exists(guid)).isTrue();
        assertThat(blobs.exists(guid, ImageFormat.JPEG)).isTrue();
        assertThat(blobs.exists(guid, ImageFormat.JPG)).isFalse();
        assertThat(blobs.getFormat(guid)).contains(ImageFormat.JPEG);
        assertThat(blobs.getFormat(ImageIds.newId())).isEmpty();
    }

    // --- delete ---

    @Test
    void deleteRemovesEveryFormat() {
        String guid = ImageIds.newId();
        blobs.save(guid, new byte[]{1}, ImageFormat.PNG);
        blobs.save(guid, new byte[]{2}, ImageFormat.SVG);

        assertThat(blobs.delete(guid)).isTrue();
        assertThat(blobs.exists(guid)).isFalse();
        assertThat(blobs.delete(guid)).isFalse();
    }

    @Test
    void deleteSingleFormat() {
        String guid = ImageIds.newId();
        blobs.save(guid, new byte[]{1}, ImageFormat.PNG);

        assertThat(blobs.delete(guid, ImageFormat.SVG)).isFalse();
        assertThat(blobs.delete(guid, ImageFormat.PNG)).isTrue();
    }

    // --- listing ---

    @Test
    void listAllIgnoresForeignFiles() throws IOException {
        String a = ImageIds.newId();
        String b = ImageIds.newId();
        blobs.save(a, new byte[]{1}, ImageFormat.PNG);
        blobs.save(b, new byte[]{1}, ImageFormat.PDF);
        Files.writeString(root.resolve("metadata.json"), "{}");
        Files.writeString(root.resolve("notes.txt"), "hello");
        Files.writeString(root.resolve(ImageIds.newId() + ".gif"), "x");
        Files.createDirectory(root.resolve(ImageIds.newId() + ".png"));

        assertThat(blobs.listAll()).containsExactlyInAnyOrder(a, b);
    }

    @Test
    void lastModifiedReflectsFileTime() throws IOException {
        String guid = ImageIds.newId();
        blobs.save(guid, new byte[]{1}, ImageFormat.PNG);
        Instant old = Instant.now().minus(40, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);
        Files.setLastModifiedTime(root.resolve(guid + ".png"), FileTime.from(old));

        assertThat(blobs.lastModified(guid, ImageFormat.PNG)).contains(old);
        assertThat(blobs.lastModified(guid, ImageFormat.SVG)).isEmpty();
    }
}
