package com.libragraph.plotstore.core.health;

import com.libragraph.plotstore.core.storage.ImageStorageBackend;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;

/**
 * Ready while the storage root is a writable directory. A metadata recovery at
 * startup is reported in the data but does not fail the check.
 */
@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    @Inject
    ImageStorageBackend storage;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("storage")
                .withData("backend", storage.backendName())
                .withData("root", storage.root().toString());
        storage.recoveryNotice().ifPresent(notice -> builder.withData("recovery", notice));
        try {
            boolean writable = Files.isDirectory(storage.root()) && Files.isWritable(storage.root());
            builder.withData("writable", writable);
            if (!writable) {
                return builder.down().build();
            }
            return builder.withData("images", storage.listImages(null).size())
                    .up()
                    .build();
        } catch (Exception e) {
            return builder.down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
