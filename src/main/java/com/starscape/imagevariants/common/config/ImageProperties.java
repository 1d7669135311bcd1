package com.starscape.imagevariants.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for variant storage.
 * Binds to app.images.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.images")
public class ImageProperties {

    /**
     * Images strictly smaller than this on both axes are stored inline.
     */
    private int inlineThreshold = 200;

    /**
     * Directory, relative to the storage root, that file-backed images are written to.
     */
    private String uploadsDirectory = "assets/uploads";

    public int getInlineThreshold() {
        return inlineThreshold;
    }

    public void setInlineThreshold(int inlineThreshold) {
        this.inlineThreshold = inlineThreshold;
    }

    public String getUploadsDirectory() {
        return uploadsDirectory;
    }

    public void setUploadsDirectory(String uploadsDirectory) {
        this.uploadsDirectory = uploadsDirectory;
    }
}
