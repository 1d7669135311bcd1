package com.starscape.imagevariants.features.getimage.api.dto;

import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;

import java.time.Instant;

/**
 * Response DTO for an image record, original or variant.
 * {@code locator} is ready for use in an img src: a data URI or a file path.
 */
public record ImageResponse(
    Long id,
    Long parentId,
    String storageKind,
    String format,
    int width,
    int height,
    Integer wantedWidth,
    Integer wantedHeight,
    String locator,
    Instant createdAt
) {

    public static ImageResponse from(ImageRecord record) {
        return new ImageResponse(
            record.getId(),
            record.getParentId(),
            record.getStorageKind().name(),
            record.getFormat().name(),
            record.getWidth(),
            record.getHeight(),
            record.getWantedWidth(),
            record.getWantedHeight(),
            record.getPublicLocator(),
            record.getCreatedAt()
        );
    }
}
