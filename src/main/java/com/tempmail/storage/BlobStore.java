package com.tempmail.storage;

import java.io.IOException;

/**
 * Write-once object storage for archived raw messages.
 * Every operation may fail; callers treat failures as best-effort.
 */
public interface BlobStore {

    void put(String key, byte[] data, String contentType) throws IOException;

    /**
     * Delete an object; deleting a missing key succeeds
     */
    void delete(String key) throws IOException;
}
