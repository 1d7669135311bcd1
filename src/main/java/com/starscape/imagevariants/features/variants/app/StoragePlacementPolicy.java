package com.starscape.imagevariants.features.variants.app;

import com.starscape.imagevariants.common.config.ImageProperties;
import com.starscape.imagevariants.common.exception.ImageVariantException;
import com.starscape.imagevariants.features.imagerecord.domain.ImageFormat;
import com.starscape.imagevariants.features.imagerecord.domain.Placement;
import com.starscape.imagevariants.features.imagerecord.domain.StorageKind;
import com.starscape.imagevariants.features.storage.domain.BlobStore;
import com.starscape.imagevariants.features.variants.domain.ImageCodec;
import org.apache.commons.codec.binary.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Clock;

/**
 * Decides where freshly produced image content is kept.
 * Images smaller than the inline threshold on both axes are PNG-encoded into
 * the record itself as base64; everything else is written to the blob store
 * in the requested format and referenced by path.
 */
@Service
public class StoragePlacementPolicy {

    private static final Logger log = LoggerFactory.getLogger(StoragePlacementPolicy.class);

    private final ImageCodec imageCodec;
    private final BlobStore blobStore;
    private final Clock clock;
    private final int inlineThreshold;
    private final String uploadsDirectory;

    public StoragePlacementPolicy(
            ImageCodec imageCodec,
            BlobStore blobStore,
            Clock clock,
            ImageProperties imageProperties) {
        this.imageCodec = imageCodec;
        this.blobStore = blobStore;
        this.clock = clock;
        this.inlineThreshold = imageProperties.getInlineThreshold();
        this.uploadsDirectory = trimSlashes(imageProperties.getUploadsDirectory());
    }

    /**
     * Encode and store {@code image}.
     *
     * @param image the decoded raster to store
     * @param requestedFormat format to use when the image is file-backed
     * @param suffix opaque file name suffix, e.g. {@code orig_42}
     * @return where the content went and what was actually stored
     */
    public Placement place(BufferedImage image, ImageFormat requestedFormat, String suffix) {
        int width = image.getWidth();
        int height = image.getHeight();

        if (width < inlineThreshold && height < inlineThreshold) {
            byte[] png = imageCodec.encode(image, ImageFormat.PNG);
            log.debug("Inlining image: {}x{}, bytes={}", width, height, png.length);
            return new Placement(StorageKind.INLINE, Base64.encodeBase64String(png), width, height, ImageFormat.PNG);
        }

        byte[] encoded = imageCodec.encode(image, requestedFormat);
        String relativePath = buildRelativePath(width, height, suffix, requestedFormat);
        try {
            blobStore.write(relativePath, encoded, requestedFormat.getMimeType());
        } catch (IOException e) {
            throw ImageVariantException.storageWriteFailure("Failed to write image file: " + relativePath, e);
        }
        log.debug("Stored image file: path={}, {}x{}", relativePath, width, height);
        return new Placement(StorageKind.FILE_BACKED, "/" + relativePath, width, height, requestedFormat);
    }

    /**
     * Blob store path for a file-backed locator.
     */
    public static String relativePathOf(String locator) {
        return locator.startsWith("/") ? locator.substring(1) : locator;
    }

    /**
     * Format: {uploads}/{width}_{height}-{epochSeconds}-{suffix}.{ext}
     */
    private String buildRelativePath(int width, int height, String suffix, ImageFormat format) {
        String fileName = String.format("%d_%d-%d-%s.%s",
                width, height, clock.instant().getEpochSecond(), suffix, format.getExtension());
        return uploadsDirectory.isEmpty() ? fileName : uploadsDirectory + "/" + fileName;
    }

    private static String trimSlashes(String directory) {
        if (directory == null) {
            return "";
        }
        String trimmed = directory.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
