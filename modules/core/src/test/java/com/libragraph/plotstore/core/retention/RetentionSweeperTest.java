package com.libragraph.plotstore.core.retention;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.plotstore.core.storage.ConsolidatedImageStorage;
import com.libragraph.plotstore.types.ImageFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.*;

class RetentionSweeperTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path root;

    String oldGuid;
    String freshGuid;
    RetentionSweeper sweeper;

    @BeforeEach
    void setUp() throws IOException {
        ConsolidatedImageStorage seed = new ConsolidatedImageStorage(root, mapper);
        oldGuid = seed.saveImage(new byte[]{1}, ImageFormat.PNG, "sales");
        freshGuid = seed.saveImage(new byte[]{2}, ImageFormat.PNG, null);

        Path document = root.resolve(ConsolidatedImageStorage.METADATA_FILE);
        ObjectNode doc = (ObjectNode) mapper.readTree(document.toFile());
        ((ObjectNode) doc.get(oldGuid)).put("created_at", Instant.now().minus(45, ChronoUnit.DAYS).toString());
        mapper.writeValue(document.toFile(), doc);

        sweeper = new RetentionSweeper();
        sweeper.storage = new ConsolidatedImageStorage(root, mapper);
    }

    @Test
    void disabledSweepRemovesNothing() {
        sweeper.maxAgeDays = 0;
        sweeper.sweep();

        assertThat(sweeper.storage.listImages(null)).containsExactlyInAnyOrder(oldGuid, freshGuid);
    }

    @Test
    void sweepRemovesExpiredImagesInEveryGroup() {
        sweeper.maxAgeDays = 30;
        sweeper.sweep();

        assertThat(sweeper.storage.listImages(null)).containsExactly(freshGuid);
    }
}
