package com.starscape.imagevariants.features.imagerecord.domain;

import com.drew.imaging.FileType;
import com.starscape.imagevariants.common.exception.ImageVariantException;

import java.util.Optional;

/**
 * Encodings an image record can be stored in.
 * Codes are persisted, so existing values must never be renumbered.
 */
public enum ImageFormat {
    PNG(0, "png", "image/png"),
    GIF(1, "gif", "image/gif"),
    JPEG(2, "jpg", "image/jpeg");

    private final int code;
    private final String extension;
    private final String mimeType;

    ImageFormat(int code, String extension, String mimeType) {
        this.code = code;
        this.extension = extension;
        this.mimeType = mimeType;
    }

    public int getCode() {
        return code;
    }

    /**
     * File extension without the dot. Also the ImageIO writer name.
     */
    public String getExtension() {
        return extension;
    }

    public String getMimeType() {
        return mimeType;
    }

    public static ImageFormat fromCode(int code) {
        for (ImageFormat format : values()) {
            if (format.code == code) {
                return format;
            }
        }
        throw ImageVariantException.persistenceFailure("Unknown image format code: " + code, null);
    }

    /**
     * Map a sniffed file type onto a storable format.
     * @return empty when the file type is not one we store
     */
    public static Optional<ImageFormat> fromFileType(FileType fileType) {
        if (fileType == null) {
            return Optional.empty();
        }
        return switch (fileType) {
            case Png -> Optional.of(PNG);
            case Gif -> Optional.of(GIF);
            case Jpeg -> Optional.of(JPEG);
            default -> Optional.empty();
        };
    }
}
