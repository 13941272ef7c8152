package com.libragraph.plotstore.core.retention;

import com.libragraph.plotstore.core.storage.ImageStorage;
import com.libragraph.plotstore.core.storage.StorageException;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Periodically purges images older than {@code plotstore.retention.max-age-days}
 * across all groups. Disabled while the setting is 0.
 */
@ApplicationScoped
public class RetentionSweeper {

    private static final Logger log = Logger.getLogger(RetentionSweeper.class);

    @Inject
    ImageStorage storage;

    @ConfigProperty(name = "plotstore.retention.max-age-days", defaultValue = "0")
    int maxAgeDays;

    @Scheduled(every = "${plotstore.retention.interval:1h}", concurrentExecution = SKIP)
    public void sweep() {
        if (maxAgeDays <= 0) {
            return;
        }
        try {
            int removed = storage.purge(maxAgeDays, null);
            if (removed > 0) {
                log.infof("Retention sweep removed %d images older than %d days", removed, maxAgeDays);
            }
        } catch (StorageException e) {
            log.errorf(e, "Retention sweep failed, will retry on the next run");
        }
    }
}
