package com.tempmail.storage;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Filesystem blob store: object keys are paths relative to the root directory
 * (root/YYYY/MM/DD/mailbox/HHMMSS-id.eml)
 */
@Slf4j
public class LocalBlobStore implements BlobStore {

    private final Path root;

    public LocalBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void put(String key, byte[] data, String contentType) throws IOException {
        Path target = resolve(key);
        Files.createDirectories(target.getParent());
        Files.write(target, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        log.debug("Blob stored: {} ({} bytes, {})", key, data.length, contentType);
    }

    @Override
    public void delete(String key) throws IOException {
        if (Files.deleteIfExists(resolve(key))) {
            log.debug("Blob deleted: {}", key);
        }
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(String key) throws IOException {
        if (key == null || key.isBlank()) {
            throw new IOException("Empty object key");
        }
        Path target = root.resolve(key).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IOException("Object key escapes storage root: " + key);
        }
        return target;
    }
}
