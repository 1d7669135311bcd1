package com.starscape.imagevariants.features.registerimage.app;

import com.drew.imaging.FileType;
import com.drew.imaging.FileTypeDetector;
import com.starscape.imagevariants.common.exception.ImageVariantException;
import com.starscape.imagevariants.features.imagerecord.domain.ImageFormat;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecordRepository;
import com.starscape.imagevariants.features.imagerecord.domain.Placement;
import com.starscape.imagevariants.features.variants.app.StoragePlacementPolicy;
import com.starscape.imagevariants.features.variants.domain.ImageCodec;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Handler for registering an uploaded original image.
 * The upload goes through the same placement rules as variants, so small
 * originals end up inline as well.
 */
@Service
public class RegisterImageHandler {

    private static final Logger log = LoggerFactory.getLogger(RegisterImageHandler.class);
    private static final int SUFFIX_HASH_LENGTH = 12;

    private final ImageRecordRepository imageRecordRepository;
    private final ImageCodec imageCodec;
    private final StoragePlacementPolicy storagePlacementPolicy;

    public RegisterImageHandler(
            ImageRecordRepository imageRecordRepository,
            ImageCodec imageCodec,
            StoragePlacementPolicy storagePlacementPolicy) {
        this.imageRecordRepository = imageRecordRepository;
        this.imageCodec = imageCodec;
        this.storagePlacementPolicy = storagePlacementPolicy;
    }

    public ImageRecord handle(byte[] content) {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Image content cannot be empty");
        }

        ImageFormat format = detectFormat(content);
        BufferedImage image = imageCodec.decode(content);

        String suffix = "upload_" + DigestUtils.sha256Hex(content).substring(0, SUFFIX_HASH_LENGTH);
        Placement placement = storagePlacementPolicy.place(image, format, suffix);

        ImageRecord saved;
        try {
            saved = imageRecordRepository.save(ImageRecord.original(placement));
        } catch (DataAccessException e) {
            throw ImageVariantException.persistenceFailure("Failed to insert image record", e);
        }

        log.info("Registered image: id={}, format={}, size={}x{}, storage={}",
                saved.getId(), format, placement.width(), placement.height(), placement.kind());
        return saved;
    }

    private ImageFormat detectFormat(byte[] content) {
        FileType fileType;
        try {
            fileType = FileTypeDetector.detectFileType(new BufferedInputStream(new ByteArrayInputStream(content)));
        } catch (IOException e) {
            throw ImageVariantException.decodeFailure("Failed to detect image type", e);
        }
        return ImageFormat.fromFileType(fileType)
                .orElseThrow(() -> ImageVariantException.decodeFailure("Unsupported image type: " + fileType, null));
    }
}
