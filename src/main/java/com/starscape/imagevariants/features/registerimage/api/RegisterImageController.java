package com.starscape.imagevariants.features.registerimage.api;

import com.starscape.imagevariants.features.getimage.api.dto.ImageResponse;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;
import com.starscape.imagevariants.features.registerimage.app.RegisterImageHandler;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/commands/images")
public class RegisterImageController {

    private final RegisterImageHandler registerImageHandler;

    public RegisterImageController(RegisterImageHandler registerImageHandler) {
        this.registerImageHandler = registerImageHandler;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImageResponse> registerImage(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
        ImageRecord record = registerImageHandler.handle(file.getBytes());
        return ResponseEntity.status(HttpStatus.CREATED).body(ImageResponse.from(record));
    }
}
