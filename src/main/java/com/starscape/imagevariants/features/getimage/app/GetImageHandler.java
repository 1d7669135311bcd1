package com.starscape.imagevariants.features.getimage.app;

import com.starscape.imagevariants.common.exception.ImageVariantException;
import com.starscape.imagevariants.features.getimage.api.dto.ImageResponse;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for reading a single image record.
 */
@Service
public class GetImageHandler {

    private final ImageRecordRepository imageRecordRepository;

    public GetImageHandler(ImageRecordRepository imageRecordRepository) {
        this.imageRecordRepository = imageRecordRepository;
    }

    @Transactional(readOnly = true)
    public ImageResponse handle(Long imageId) {
        ImageRecord record = imageRecordRepository.findById(imageId)
                .orElseThrow(() -> ImageVariantException.notFound("Image not found: " + imageId));
        return ImageResponse.from(record);
    }
}
