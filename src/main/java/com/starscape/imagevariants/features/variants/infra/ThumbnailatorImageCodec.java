package com.starscape.imagevariants.features.variants.infra;

import com.starscape.imagevariants.common.exception.ImageVariantException;
import com.starscape.imagevariants.features.imagerecord.domain.ImageFormat;
import com.starscape.imagevariants.features.variants.domain.ImageCodec;
import net.coobird.thumbnailator.Thumbnails;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * ImageIO for reading and writing, Thumbnailator for scaling.
 */
@Component
public class ThumbnailatorImageCodec implements ImageCodec {

    @Override
    public BufferedImage decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw ImageVariantException.decodeFailure("Image content is empty", null);
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                throw ImageVariantException.decodeFailure("Unsupported or malformed image content", null);
            }
            return image;
        } catch (IOException e) {
            throw ImageVariantException.decodeFailure("Failed to read image: " + e.getMessage(), e);
        }
    }

    @Override
    public BufferedImage resize(BufferedImage image, int width, int height) {
        try {
            return Thumbnails.of(image)
                    .size(width, height)
                    .asBufferedImage();
        } catch (IOException | IllegalArgumentException e) {
            throw ImageVariantException.encodeFailure(
                String.format("Failed to resize image to %dx%d: %s", width, height, e.getMessage()), e);
        }
    }

    @Override
    public byte[] encode(BufferedImage image, ImageFormat format) {
        BufferedImage source = format == ImageFormat.JPEG ? withoutAlpha(image) : image;
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(source, format.getExtension(), output)) {
                throw ImageVariantException.encodeFailure("No image writer available for " + format, null);
            }
        } catch (IOException e) {
            throw ImageVariantException.encodeFailure("Failed to encode image as " + format, e);
        }
        return output.toByteArray();
    }

    /**
     * JPEG has no alpha channel; ImageIO silently refuses ARGB input for it.
     */
    private BufferedImage withoutAlpha(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, Color.WHITE, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
