package com.libragraph.plotstore.types;

import com.libragraph.plotstore.util.ImageIds;

import java.util.Objects;
import java.util.Optional;

/**
 * Location of one stored blob: GUID plus format.
 *
 * <p>String format: {@code {guid}.{extension}}, which is also the blob's file name.
 */
public record BlobKey(String guid, ImageFormat format) {

    public BlobKey {
        ImageIds.requireCanonical(guid);
        Objects.requireNonNull(format, "format cannot be null");
    }

    public static BlobKey of(String guid, ImageFormat format) {
        return new BlobKey(guid, format);
    }

    /**
     * Parses a file name back into a BlobKey.
     *
     * @throws IllegalArgumentException if the name is not {@code {guid}.{known-extension}}
     */
    public static BlobKey parse(String fileName) {
        Objects.requireNonNull(fileName, "fileName cannot be null");

        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            throw new IllegalArgumentException("Invalid blob file name (no extension): " + fileName);
        }
        String guid = fileName.substring(0, dot);
        ImageFormat format = ImageFormat.tryFromExtension(fileName.substring(dot + 1))
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid blob file name (unknown extension): " + fileName));
        return new BlobKey(guid, format);
    }

    /** Like {@link #parse} but returns empty for names that are not blob files. */
    public static Optional<BlobKey> tryParse(String fileName) {
        try {
            return Optional.of(parse(fileName));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String fileName() {
        return guid + "." + format.extension();
    }

    @Override
    public String toString() {
        return fileName();
    }
}
