package com.starscape.imagevariants.features.variants.domain;

import com.starscape.imagevariants.features.imagerecord.domain.ImageFormat;

import java.awt.image.BufferedImage;

/**
 * Decode, resize and encode raster images.
 * Failures are reported as {@link com.starscape.imagevariants.common.exception.ImageVariantException}.
 */
public interface ImageCodec {

    BufferedImage decode(byte[] bytes);

    /**
     * Scale {@code image} to fit inside a {@code width}x{@code height} box, keeping its aspect ratio.
     */
    BufferedImage resize(BufferedImage image, int width, int height);

    byte[] encode(BufferedImage image, ImageFormat format);
}
