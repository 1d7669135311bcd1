package com.starscape.imagevariants.features.deleteimage.app;

import com.starscape.imagevariants.common.exception.ImageVariantException;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecordRepository;
import com.starscape.imagevariants.features.imagerecord.domain.StorageKind;
import com.starscape.imagevariants.features.storage.domain.BlobStore;
import com.starscape.imagevariants.features.variants.app.StoragePlacementPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Handler for deleting an image record and its stored file.
 * A record that variants still point at cannot be deleted; delete the variants first.
 */
@Service
public class DeleteImageHandler {

    private static final Logger log = LoggerFactory.getLogger(DeleteImageHandler.class);

    private final ImageRecordRepository imageRecordRepository;
    private final BlobStore blobStore;

    public DeleteImageHandler(ImageRecordRepository imageRecordRepository, BlobStore blobStore) {
        this.imageRecordRepository = imageRecordRepository;
        this.blobStore = blobStore;
    }

    public void handle(Long imageId) {
        ImageRecord record = imageRecordRepository.findById(imageId)
                .orElseThrow(() -> ImageVariantException.notFound("Image not found: " + imageId));

        long children = imageRecordRepository.countByParentId(imageId);
        if (children > 0) {
            throw new IllegalStateException(
                String.format("Image %d still has %d variant(s) referencing it", imageId, children));
        }

        try {
            imageRecordRepository.delete(record);
        } catch (DataIntegrityViolationException e) {
            // A variant was inserted after the count above
            throw new IllegalStateException("Image " + imageId + " gained a variant while being deleted", e);
        }

        if (record.getStorageKind() == StorageKind.FILE_BACKED) {
            deleteFileIfUnreferenced(imageId, record.getLocator());
        }

        log.info("Deleted image: id={}, parentId={}", imageId, record.getParentId());
    }

    private void deleteFileIfUnreferenced(Long imageId, String locator) {
        long sharing = imageRecordRepository.countByLocator(locator);
        if (sharing > 0) {
            log.info("Keeping file of image {}: {} other record(s) still use {}", imageId, sharing, locator);
            return;
        }

        String relativePath = StoragePlacementPolicy.relativePathOf(locator);
        if (!blobStore.delete(relativePath)) {
            log.warn("Image {} deleted but its file could not be removed: {}", imageId, relativePath);
        }
    }
}
