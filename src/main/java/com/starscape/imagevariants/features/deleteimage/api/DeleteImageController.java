package com.starscape.imagevariants.features.deleteimage.api;

import com.starscape.imagevariants.features.deleteimage.app.DeleteImageHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands/images")
public class DeleteImageController {

    private final DeleteImageHandler deleteImageHandler;

    public DeleteImageController(DeleteImageHandler deleteImageHandler) {
        this.deleteImageHandler = deleteImageHandler;
    }

    /**
     * DELETE /commands/images/{imageId}
     */
    @DeleteMapping("/{imageId}")
    public ResponseEntity<Void> deleteImage(@PathVariable Long imageId) {
        deleteImageHandler.handle(imageId);
        return ResponseEntity.noContent().build();
    }
}
