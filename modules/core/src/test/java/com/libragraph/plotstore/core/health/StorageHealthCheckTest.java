package com.libragraph.plotstore.core.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.plotstore.core.storage.ConsolidatedImageStorage;
import com.libragraph.plotstore.types.ImageFormat;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class StorageHealthCheckTest {

    @TempDir
    Path root;

    private StorageHealthCheck check(ConsolidatedImageStorage storage) {
        StorageHealthCheck check = new StorageHealthCheck();
        check.storage = storage;
        return check;
    }

    @Test
    void upWithImageCount() {
        ConsolidatedImageStorage storage = new ConsolidatedImageStorage(root, new ObjectMapper());
        storage.saveImage(new byte[]{1}, ImageFormat.PNG, null);

        HealthCheckResponse response = check(storage).call();

        assertThat(response.getName()).isEqualTo("storage");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> {
            assertThat(data).containsEntry("backend", "file");
            assertThat(data).containsEntry("images", 1L);
            assertThat(data).doesNotContainKey("recovery");
        });
    }

    @Test
    void reportsRecoveryNotice() throws IOException {
        Files.writeString(root.resolve("metadata.json"), "[]");
        ConsolidatedImageStorage storage = new ConsolidatedImageStorage(root, new ObjectMapper());

        HealthCheckResponse response = check(storage).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data).containsKey("recovery"));
    }
}
