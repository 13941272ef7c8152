package com.libragraph.plotstore.core.storage;

import com.libragraph.plotstore.types.ImageFormat;

import java.util.Objects;

/**
 * Bytes of a retrieved image together with the format they were stored in.
 */
public record StoredImage(String guid, byte[] data, ImageFormat format) {

    public StoredImage {
        Objects.requireNonNull(guid, "guid cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(format, "format cannot be null");
    }

    public int size() {
        return data.length;
    }
}
