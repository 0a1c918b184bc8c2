package com.tempmail.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LocalBlobStore unit tests
 */
class LocalBlobStoreTest {

    @TempDir
    Path tempDir;

    private LocalBlobStore store;

    @BeforeEach
    void setUp() {
        store = new LocalBlobStore(tempDir.resolve("eml"));
    }

    @Test
    @DisplayName("Save EML object under its key")
    void testPut() throws IOException {
        byte[] emlData = "Subject: Test\r\n\r\nHello World".getBytes();

        store.put("2024/03/05/a@b.com/070809-x.eml", emlData, "message/rfc822");

        assertThat(Files.readAllBytes(store.getRoot().resolve("2024/03/05/a@b.com/070809-x.eml"))).isEqualTo(emlData);
    }

    @Test
    @DisplayName("Objects are write-once")
    void testPutExisting() throws IOException {
        store.put("k/1.eml", "one".getBytes(), "message/rfc822");

        assertThatThrownBy(() -> store.put("k/1.eml", "two".getBytes(), "message/rfc822"))
                .isInstanceOf(FileAlreadyExistsException.class);
        assertThat(Files.readAllBytes(store.getRoot().resolve("k/1.eml"))).isEqualTo("one".getBytes());
    }

    @Test
    @DisplayName("Delete EML object, deleting again succeeds")
    void testDelete() throws IOException {
        store.put("k/2.eml", "data".getBytes(), "message/rfc822");

        store.delete("k/2.eml");
        store.delete("k/2.eml");

        assertThat(Files.exists(store.getRoot().resolve("k/2.eml"))).isFalse();
    }

    @Test
    @DisplayName("Keys outside the root are rejected")
    void testKeyEscape() {
        assertThatThrownBy(() -> store.put("../outside.eml", "x".getBytes(), "message/rfc822"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("escapes");
        assertThatThrownBy(() -> store.delete("")).isInstanceOf(IOException.class);
        assertThat(Files.exists(tempDir.resolve("outside.eml"))).isFalse();
    }
}
