package com.libragraph.plotstore.core.storage.metadata;

import com.libragraph.plotstore.types.ImageFormat;

import java.time.Instant;
import java.util.Optional;

/**
 * Age fallback for records whose {@code created_at} is missing or unparsable.
 * Usually {@code blobRepository::lastModified}.
 */
@FunctionalInterface
public interface BlobTimestamps {

    BlobTimestamps NONE = (guid, format) -> Optional.empty();

    Optional<Instant> lastModified(String guid, ImageFormat format);
}
