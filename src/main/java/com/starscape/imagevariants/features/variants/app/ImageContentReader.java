package com.starscape.imagevariants.features.variants.app;

import com.starscape.imagevariants.common.exception.ImageVariantException;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;
import com.starscape.imagevariants.features.storage.domain.BlobStore;
import org.apache.commons.codec.binary.Base64;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Loads the encoded bytes behind an image record. Inline payloads are decoded
 * on every call rather than cached.
 */
@Component
public class ImageContentReader {

    private final BlobStore blobStore;

    public ImageContentReader(BlobStore blobStore) {
        this.blobStore = blobStore;
    }

    public byte[] readBytes(ImageRecord record) {
        return switch (record.getStorageKind()) {
            case INLINE -> Base64.decodeBase64(record.getLocator());
            case FILE_BACKED -> readFile(record);
        };
    }

    private byte[] readFile(ImageRecord record) {
        String relativePath = StoragePlacementPolicy.relativePathOf(record.getLocator());
        try {
            return blobStore.read(relativePath);
        } catch (IOException e) {
            throw ImageVariantException.decodeFailure(
                String.format("Cannot read content of image %d at %s", record.getId(), relativePath), e);
        }
    }
}
