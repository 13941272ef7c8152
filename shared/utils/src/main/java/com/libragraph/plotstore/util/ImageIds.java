package com.libragraph.plotstore.util;

import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * GUIDs that key stored images.
 *
 * <p>Only the canonical {@code 8-4-4-4-12} hex form is accepted.
 * {@link UUID#fromString} also takes shortened groups such as {@code 1-2-3-4-5},
 * which must never reach a filename.
 */
public final class ImageIds {

    private static final Pattern CANONICAL = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private ImageIds() {
    }

    /**
     * Generates a new random (version 4) GUID. {@link UUID#randomUUID()} draws from
     * {@link java.security.SecureRandom}.
     */
    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static boolean isCanonical(String candidate) {
        return candidate != null && CANONICAL.matcher(candidate).matches();
    }

    /**
     * @throws IllegalArgumentException if {@code guid} is not a canonical GUID
     */
    public static String requireCanonical(String guid) {
        Objects.requireNonNull(guid, "guid cannot be null");
        if (!isCanonical(guid)) {
            throw new IllegalArgumentException("Invalid GUID format: " + guid);
        }
        return guid;
    }
}
