package com.starscape.imagevariants.integration;

import com.starscape.imagevariants.features.imagerecord.domain.ImageFormat;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;
import com.starscape.imagevariants.features.imagerecord.domain.Placement;
import com.starscape.imagevariants.features.imagerecord.domain.StorageKind;
import org.springframework.test.util.ReflectionTestUtils;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Utility class for tests.
 * Provides helpers for creating test images and image records.
 */
public class TestUtils {

    /**
     * Create a raster with a gradient so scaled output is not a flat color.
     */
    public static BufferedImage createRaster(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        for (int y = 0; y < height; y++) {
            int colorValue = (int) (255 * ((double) y / height));
            g.setColor(new Color(colorValue, colorValue, colorValue));
            g.drawLine(0, y, width, y);
        }
        g.dispose();
        return image;
    }

    /**
     * Create a test PNG image with specified dimensions.
     */
    public static byte[] createTestPngImage(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.BLUE);
        g.fillRect(0, 0, width, height);
        g.setColor(Color.WHITE);
        g.fillOval(width / 4, height / 4, width / 2, height / 2);
        g.dispose();

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        ImageIO.write(image, "png", baos);
        return baos.toByteArray();
    }

    /**
     * Create a simple test JPEG image with specified dimensions.
     */
    public static byte[] createTestJpegImage(int width, int height) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        ImageIO.write(createRaster(width, height), "jpg", baos);
        return baos.toByteArray();
    }

    /**
     * Build an original record as if it had been loaded from the database.
     */
    public static ImageRecord persistedOriginal(long id, StorageKind kind, String locator,
                                                int width, int height, ImageFormat format) {
        ImageRecord record = ImageRecord.original(new Placement(kind, locator, width, height, format));
        ReflectionTestUtils.setField(record, "id", id);
        return record;
    }
}
