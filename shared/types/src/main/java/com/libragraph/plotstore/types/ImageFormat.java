package com.libragraph.plotstore.types;

import java.util.Locale;
import java.util.Optional;

/**
 * Formats a rendered chart can be stored in.
 *
 * <p>Declaration order is the probing order used when a blob's format is unknown.
 */
public enum ImageFormat {
    PNG("png", "image/png"),
    JPG("jpg", "image/jpeg"),
    JPEG("jpeg", "image/jpeg"),
    SVG("svg", "image/svg+xml"),
    PDF("pdf", "application/pdf");

    private final String extension;
    private final String mimeType;

    ImageFormat(String extension, String mimeType) {
        this.extension = extension;
        this.mimeType = mimeType;
    }

    public String extension() {
        return extension;
    }

    public String mimeType() {
        return mimeType;
    }

    /** Case-insensitive lookup by extension, without the leading dot. */
    public static Optional<ImageFormat> tryFromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        for (ImageFormat f : values()) {
            if (f.extension.equals(normalized)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public static ImageFormat fromExtension(String extension) {
        return tryFromExtension(extension)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported image format: " + extension));
    }
}
