package com.starscape.imagevariants.features.storage.domain;

import java.io.IOException;

/**
 * Durable byte storage addressed by a relative path such as
 * {@code assets/uploads/640_480-1700000000-orig_7.jpg}.
 */
public interface BlobStore {

    void write(String relativePath, byte[] content, String contentType) throws IOException;

    byte[] read(String relativePath) throws IOException;

    /**
     * @return true if the object was removed or did not exist, false on error
     */
    boolean delete(String relativePath);
}
