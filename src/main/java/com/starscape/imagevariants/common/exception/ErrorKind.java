package com.starscape.imagevariants.common.exception;

/**
 * Failure categories surfaced by image variant operations.
 */
public enum ErrorKind {
    DECODE_FAILURE,
    ENCODE_FAILURE,
    STORAGE_WRITE_FAILURE,
    PERSISTENCE_FAILURE,
    NOT_FOUND
}
