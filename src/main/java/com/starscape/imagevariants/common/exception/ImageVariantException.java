package com.starscape.imagevariants.common.exception;

/**
 * Single tagged failure type for reading, deriving and persisting images.
 * Nothing that raises it retries; the caller decides what to do.
 */
public class ImageVariantException extends RuntimeException {

    private final ErrorKind kind;

    public ImageVariantException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ImageVariantException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ImageVariantException decodeFailure(String message, Throwable cause) {
        return new ImageVariantException(ErrorKind.DECODE_FAILURE, message, cause);
    }

    public static ImageVariantException encodeFailure(String message, Throwable cause) {
        return new ImageVariantException(ErrorKind.ENCODE_FAILURE, message, cause);
    }

    public static ImageVariantException storageWriteFailure(String message, Throwable cause) {
        return new ImageVariantException(ErrorKind.STORAGE_WRITE_FAILURE, message, cause);
    }

    public static ImageVariantException persistenceFailure(String message, Throwable cause) {
        return new ImageVariantException(ErrorKind.PERSISTENCE_FAILURE, message, cause);
    }

    public static ImageVariantException notFound(String message) {
        return new ImageVariantException(ErrorKind.NOT_FOUND, message);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
