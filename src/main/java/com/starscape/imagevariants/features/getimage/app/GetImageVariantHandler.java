package com.starscape.imagevariants.features.getimage.app;

import com.starscape.imagevariants.features.getimage.api.dto.ImageResponse;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;
import com.starscape.imagevariants.features.variants.app.VariantResolver;
import org.springframework.stereotype.Service;

/**
 * Handler for fetching an image at a given size, creating the variant on first request.
 */
@Service
public class GetImageVariantHandler {

    private final VariantResolver variantResolver;

    public GetImageVariantHandler(VariantResolver variantResolver) {
        this.variantResolver = variantResolver;
    }

    public ImageResponse handle(Long imageId, int width, int height) {
        ImageRecord variant = variantResolver.resolve(imageId, width, height);
        return ImageResponse.from(variant);
    }
}
