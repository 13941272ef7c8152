package com.libragraph.plotstore.core.storage.metadata;

import com.libragraph.plotstore.types.ImageFormat;
import com.libragraph.plotstore.util.UtcTimestamps;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured attributes of one stored image.
 *
 * <p>{@code createdAt} is kept as the stored text: documents written by older
 * releases may hold values that do not parse, and those must survive a rewrite.
 * {@code group} and {@code alias} are nullable.
 *
 * <p>{@code aliasGroup} is the scope the alias was registered in. It is only set when
 * that scope differs from {@code group}, which happens when a group names a public image.
 */
public record ImageMetadata(
        String guid,
        ImageFormat format,
        long size,
        String createdAt,
        String group,
        String alias,
        String aliasGroup
) {

    public ImageMetadata {
        Objects.requireNonNull(guid, "guid cannot be null");
        Objects.requireNonNull(format, "format cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got: " + size);
        }
    }

    public ImageMetadata(String guid, ImageFormat format, long size, String createdAt,
                         String group, String alias) {
        this(guid, format, size, createdAt, group, alias, null);
    }

    /** Record for a freshly saved image: no alias yet, timestamped {@code now}. */
    public static ImageMetadata created(String guid, ImageFormat format, long size,
                                        String group, Instant now) {
        return new ImageMetadata(guid, format, size, UtcTimestamps.format(now), group, null);
    }

    public Optional<Instant> createdInstant() {
        return UtcTimestamps.parse(createdAt);
    }

    /**
     * Assigns {@code newAlias} registered in {@code scope}; a null alias clears both.
     */
    public ImageMetadata withAlias(String newAlias, String scope) {
        String storedScope = newAlias == null || Objects.equals(scope, group) ? null : scope;
        return new ImageMetadata(guid, format, size, createdAt, group, newAlias, storedScope);
    }

    /** Group scope the alias lives in: {@code aliasGroup} when set, otherwise the image's group. */
    public String aliasScope() {
        return aliasGroup != null ? aliasGroup : group;
    }

    /**
     * True when a caller in {@code requestedGroup} may read or modify this image:
     * public images are open to everyone, otherwise groups must match exactly.
     */
    public boolean accessibleFrom(String requestedGroup) {
        return group == null || group.equals(requestedGroup);
    }

    /** True when this record falls in a listing/purge scope; a null scope means everything. */
    public boolean inScope(String scopeGroup) {
        return scopeGroup == null || scopeGroup.equals(group);
    }
}
