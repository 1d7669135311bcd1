package com.starscape.imagevariants.features.imagerecord.domain;

import java.util.Optional;

public interface ImageRecordRepository {
    ImageRecord save(ImageRecord record);
    Optional<ImageRecord> findById(Long id);

    /**
     * Find one stored variant of {@code parentId} that can stand in for a
     * {@code width}x{@code height} request. A child matches when it has no
     * wanted size and either actual dimension equals the request, or when
     * either wanted dimension equals the request. Largest width, then largest
     * height, wins.
     */
    Optional<ImageRecord> findChild(Long parentId, int width, int height);

    long countByParentId(Long parentId);

    /**
     * Rows stored at {@code locator}. File names are not unique per row, so
     * duplicates created in the same second share one file.
     */
    long countByLocator(String locator);

    void delete(ImageRecord record);
}
