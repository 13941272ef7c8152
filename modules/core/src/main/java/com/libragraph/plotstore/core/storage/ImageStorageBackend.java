package com.libragraph.plotstore.core.storage;

import java.nio.file.Path;
import java.util.Optional;

/**
 * An {@link ImageStorage} implementation as seen by the composition root and
 * health checks. Request handlers should depend on {@link ImageStorage} only.
 */
public interface ImageStorageBackend extends ImageStorage {

    /** Registry name of this backend, e.g. {@code file}. */
    String backendName();

    /** Directory holding the blobs. */
    Path root();

    /** Present when the metadata document was found corrupt at startup. */
    Optional<String> recoveryNotice();
}
