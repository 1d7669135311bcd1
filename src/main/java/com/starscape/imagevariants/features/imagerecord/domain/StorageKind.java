package com.starscape.imagevariants.features.imagerecord.domain;

import com.starscape.imagevariants.common.exception.ImageVariantException;

/**
 * How an image record's locator is interpreted.
 * Codes are persisted, so existing values must never be renumbered.
 */
public enum StorageKind {
    FILE_BACKED(0),
    INLINE(1);

    private final int code;

    StorageKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static StorageKind fromCode(int code) {
        for (StorageKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw ImageVariantException.persistenceFailure("Unknown storage kind code: " + code, null);
    }
}
