package com.starscape.imagevariants.features.storage.infra;

import com.starscape.imagevariants.features.storage.domain.BlobStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Stores image files on the local filesystem below a configured root.
 * Active unless the {@code s3} profile is selected.
 */
@Service
@Profile("!s3")
public class LocalFileBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(LocalFileBlobStore.class);

    private final String rootDirectory;
    private Path rootLocation;

    public LocalFileBlobStore(@Value("${app.storage.local.root:.}") String rootDirectory) {
        this.rootDirectory = rootDirectory;
    }

    @PostConstruct
    public void init() throws IOException {
        rootLocation = Paths.get(rootDirectory).toAbsolutePath().normalize();
        log.info("Local storage root: {}", rootLocation);

        if (!Files.exists(rootLocation)) {
            Files.createDirectories(rootLocation);
            log.info("Created local storage root");
        }
    }

    @Override
    public void write(String relativePath, byte[] content, String contentType) throws IOException {
        Path target = resolve(relativePath);
        Files.createDirectories(target.getParent());
        Files.write(target, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        log.debug("Stored file: path={}, bytes={}", target, content.length);
    }

    @Override
    public byte[] read(String relativePath) throws IOException {
        Path file = resolve(relativePath);
        if (!Files.exists(file)) {
            throw new FileNotFoundException("File not found: " + relativePath);
        }
        return Files.readAllBytes(file);
    }

    @Override
    public boolean delete(String relativePath) {
        try {
            Files.deleteIfExists(resolve(relativePath));
            log.info("Deleted file: {}", relativePath);
            return true;
        } catch (IOException e) {
            log.error("Failed to delete file: {}", relativePath, e);
            return false;
        }
    }

    private Path resolve(String relativePath) throws IOException {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IOException("Path cannot be blank");
        }
        Path resolved = rootLocation.resolve(relativePath).normalize();
        if (!resolved.startsWith(rootLocation)) {
            throw new IOException("Cannot access path outside storage root: " + relativePath);
        }
        return resolved;
    }
}
