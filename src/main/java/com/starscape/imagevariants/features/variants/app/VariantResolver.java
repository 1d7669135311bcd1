package com.starscape.imagevariants.features.variants.app;

import com.starscape.imagevariants.common.exception.ImageVariantException;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecordRepository;
import com.starscape.imagevariants.features.imagerecord.domain.Placement;
import com.starscape.imagevariants.features.variants.domain.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Finds or creates a variant of an image at a requested size.
 *
 * <ul>
 *   <li>A parent that already fits inside the requested box is returned as is; nothing is upscaled.</li>
 *   <li>Otherwise an existing child matching the request is reused.</li>
 *   <li>Otherwise the parent is decoded, resized, placed and persisted as a new child.</li>
 * </ul>
 *
 * There is no locking: concurrent misses for the same request each create a
 * child, and later lookups return whichever sorts first.
 */
@Service
public class VariantResolver {

    private static final Logger log = LoggerFactory.getLogger(VariantResolver.class);

    private final ImageRecordRepository imageRecordRepository;
    private final ImageCodec imageCodec;
    private final StoragePlacementPolicy storagePlacementPolicy;
    private final ImageContentReader imageContentReader;

    public VariantResolver(
            ImageRecordRepository imageRecordRepository,
            ImageCodec imageCodec,
            StoragePlacementPolicy storagePlacementPolicy,
            ImageContentReader imageContentReader) {
        this.imageRecordRepository = imageRecordRepository;
        this.imageCodec = imageCodec;
        this.storagePlacementPolicy = storagePlacementPolicy;
        this.imageContentReader = imageContentReader;
    }

    /**
     * Resolve a variant of the image with the given id.
     */
    public ImageRecord resolve(Long parentId, int width, int height) {
        ImageRecord parent = load(parentId)
                .orElseThrow(() -> ImageVariantException.notFound("Image not found: " + parentId));
        return resolve(parent, width, height);
    }

    /**
     * Return a record showing {@code parent} at no more than {@code width}x{@code height}.
     */
    public ImageRecord resolve(ImageRecord parent, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                String.format("Requested size must be positive: %dx%d", width, height));
        }

        if (!parent.needsDownscaleFor(width, height)) {
            log.debug("Image {} ({}x{}) already fits {}x{}",
                    parent.getId(), parent.getWidth(), parent.getHeight(), width, height);
            return parent;
        }

        Optional<ImageRecord> existing = findChild(parent.getId(), width, height);
        if (existing.isPresent()) {
            log.debug("Reusing variant {} of image {} for {}x{}",
                    existing.get().getId(), parent.getId(), width, height);
            return existing.get();
        }

        return createVariant(parent, width, height);
    }

    private ImageRecord createVariant(ImageRecord parent, int width, int height) {
        log.info("Creating variant: parentId={}, requested={}x{}", parent.getId(), width, height);

        byte[] parentBytes = imageContentReader.readBytes(parent);
        BufferedImage decoded = imageCodec.decode(parentBytes);
        BufferedImage resized = imageCodec.resize(decoded, width, height);

        Placement placement = storagePlacementPolicy.place(resized, parent.getFormat(), "orig_" + parent.getId());
        ImageRecord variant = ImageRecord.variantOf(parent, placement, width, height);

        Long variantId = save(variant).getId();

        // Re-read so callers see the stored row, not the local copy
        ImageRecord stored = load(variantId)
                .orElseThrow(() -> ImageVariantException.persistenceFailure(
                    "Variant " + variantId + " was not readable after insert", null));

        log.info("Created variant: id={}, parentId={}, size={}x{}, storage={}",
                stored.getId(), parent.getId(), stored.getWidth(), stored.getHeight(), stored.getStorageKind());
        return stored;
    }

    private Optional<ImageRecord> findChild(Long parentId, int width, int height) {
        try {
            return imageRecordRepository.findChild(parentId, width, height);
        } catch (DataAccessException e) {
            throw ImageVariantException.persistenceFailure("Failed to look up variants of image " + parentId, e);
        }
    }

    private Optional<ImageRecord> load(Long id) {
        try {
            return imageRecordRepository.findById(id);
        } catch (DataAccessException e) {
            throw ImageVariantException.persistenceFailure("Failed to load image " + id, e);
        }
    }

    private ImageRecord save(ImageRecord record) {
        try {
            return imageRecordRepository.save(record);
        } catch (DataAccessException e) {
            throw ImageVariantException.persistenceFailure("Failed to insert image record", e);
        }
    }
}
