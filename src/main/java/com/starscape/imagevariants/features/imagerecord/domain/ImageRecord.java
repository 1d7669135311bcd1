package com.starscape.imagevariants.features.imagerecord.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Persisted metadata for an original image or a resized variant of one.
 * Every field is written once at construction; records are never updated.
 */
@Entity
@Table(name = "images")
public class ImageRecord {

    private static final String INLINE_PREFIX = "data:image/png;base64,";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false)
    private Long id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "host_type", nullable = false, updatable = false)
    private int storageKindCode;

    @Column(name = "path", nullable = false, updatable = false, columnDefinition = "text")
    private String locator;

    @Column(nullable = false, updatable = false)
    private int width;

    @Column(nullable = false, updatable = false)
    private int height;

    @Column(name = "parent_id", updatable = false)
    private Long parentId;

    @Column(name = "wanted_width", updatable = false)
    private Integer wantedWidth;

    @Column(name = "wanted_height", updatable = false)
    private Integer wantedHeight;

    @Column(name = "format", nullable = false, updatable = false)
    private int formatCode;

    protected ImageRecord() {
        // JPA constructor
    }

    private ImageRecord(Placement placement, Long parentId, Integer wantedWidth, Integer wantedHeight) {
        validateInput(placement, wantedWidth, wantedHeight);

        this.storageKindCode = placement.kind().getCode();
        this.locator = placement.locator();
        this.width = placement.width();
        this.height = placement.height();
        this.formatCode = placement.format().getCode();
        this.parentId = parentId;
        this.wantedWidth = wantedWidth;
        this.wantedHeight = wantedHeight;
        this.createdAt = Instant.now();
    }

    /**
     * A record for an uploaded original, with no parent and no wanted size.
     */
    public static ImageRecord original(Placement placement) {
        return new ImageRecord(placement, null, null, null);
    }

    /**
     * A record for content derived from {@code parent} in answer to a
     * {@code wantedWidth}x{@code wantedHeight} request.
     */
    public static ImageRecord variantOf(ImageRecord parent, Placement placement, int wantedWidth, int wantedHeight) {
        if (parent == null || parent.getId() == null) {
            throw new IllegalArgumentException("Parent must be a persisted image record");
        }
        return new ImageRecord(placement, parent.getId(), wantedWidth, wantedHeight);
    }

    private void validateInput(Placement placement, Integer wantedWidth, Integer wantedHeight) {
        if (placement == null) {
            throw new IllegalArgumentException("Placement cannot be null");
        }
        if (placement.width() <= 0 || placement.height() <= 0) {
            throw new IllegalArgumentException(
                String.format("Dimensions must be positive: %dx%d", placement.width(), placement.height()));
        }
        if ((wantedWidth == null) != (wantedHeight == null)) {
            throw new IllegalArgumentException("Wanted width and height must both be set or both be absent");
        }
        if (wantedWidth != null && (wantedWidth <= 0 || wantedHeight <= 0)) {
            throw new IllegalArgumentException("Wanted dimensions must be positive");
        }
    }

    // Getters
    public Long getId() { return id; }
    public Instant getCreatedAt() { return createdAt; }
    public String getLocator() { return locator; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public Long getParentId() { return parentId; }
    public Integer getWantedWidth() { return wantedWidth; }
    public Integer getWantedHeight() { return wantedHeight; }

    public StorageKind getStorageKind() {
        return StorageKind.fromCode(storageKindCode);
    }

    public ImageFormat getFormat() {
        return ImageFormat.fromCode(formatCode);
    }

    public boolean isOriginal() {
        return parentId == null;
    }

    /**
     * True when the stored content is larger than the box in either dimension.
     * Images are never upscaled, so anything else already satisfies the request.
     */
    public boolean needsDownscaleFor(int requestedWidth, int requestedHeight) {
        return width > requestedWidth || height > requestedHeight;
    }

    /**
     * Locator as a presentation layer uses it: a PNG data URI for inline
     * content, the file path otherwise.
     */
    public String getPublicLocator() {
        return switch (getStorageKind()) {
            case INLINE -> INLINE_PREFIX + locator;
            case FILE_BACKED -> locator;
        };
    }
}
