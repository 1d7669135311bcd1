package com.starscape.imagevariants.features.imagerecord.domain;

/**
 * Where freshly encoded image content ended up, plus what was actually stored.
 */
public record Placement(
    StorageKind kind,
    String locator,
    int width,
    int height,
    ImageFormat format
) {

    public Placement {
        if (kind == null) {
            throw new IllegalArgumentException("Storage kind cannot be null");
        }
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("Locator cannot be blank");
        }
        if (format == null) {
            throw new IllegalArgumentException("Format cannot be null");
        }
    }
}
