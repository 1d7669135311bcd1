package com.starscape.imagevariants.features.getimage.api;

import com.starscape.imagevariants.features.getimage.api.dto.ImageResponse;
import com.starscape.imagevariants.features.getimage.app.GetImageHandler;
import com.starscape.imagevariants.features.getimage.app.GetImageVariantHandler;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for reading image records and sized variants of them.
 */
@RestController
@RequestMapping("/queries/images")
@Validated
public class ImageQueryController {

    private final GetImageHandler getImageHandler;
    private final GetImageVariantHandler getImageVariantHandler;

    public ImageQueryController(
            GetImageHandler getImageHandler,
            GetImageVariantHandler getImageVariantHandler) {
        this.getImageHandler = getImageHandler;
        this.getImageVariantHandler = getImageVariantHandler;
    }

    @GetMapping("/{imageId}")
    public ResponseEntity<ImageResponse> getImage(@PathVariable Long imageId) {
        return ResponseEntity.ok(getImageHandler.handle(imageId));
    }

    /**
     * GET /queries/images/{imageId}/variant?width=100&amp;height=80
     */
    @GetMapping("/{imageId}/variant")
    public ResponseEntity<ImageResponse> getVariant(
            @PathVariable Long imageId,
            @RequestParam @Min(1) int width,
            @RequestParam @Min(1) int height) {

        return ResponseEntity.ok(getImageVariantHandler.handle(imageId, width, height));
    }
}
