package com.mediaflow.mediaflow_backend.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemMediaStorageTest {

    @TempDir
    Path root;

    @Test
    void uploadWritesUnderTheRootAndReturnsThePublicUrl() throws Exception {
        FileSystemMediaStorage storage = new FileSystemMediaStorage(root, "https://cdn.example.com/media/");

        String url = storage.upload("executions/abc/job1.mp3", "audio".getBytes(StandardCharsets.UTF_8), "audio/mpeg");

        assertThat(url).isEqualTo("https://cdn.example.com/media/executions/abc/job1.mp3");
        assertThat(Files.readString(root.resolve("executions/abc/job1.mp3"))).isEqualTo("audio");
        try (var files = Files.list(root.resolve("executions/abc"))) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void uploadReplacesAnExistingObject() throws Exception {
        FileSystemMediaStorage storage = new FileSystemMediaStorage(root, "http://localhost/media");
        storage.upload("a.txt", "first".getBytes(StandardCharsets.UTF_8), "text/plain");

        storage.upload("a.txt", "second".getBytes(StandardCharsets.UTF_8), "text/plain");

        assertThat(Files.readString(root.resolve("a.txt"))).isEqualTo("second");
    }

    @Test
    void pathsEscapingTheRootAreRejected() {
        FileSystemMediaStorage storage = new FileSystemMediaStorage(root, "http://localhost/media");

        assertThatThrownBy(() -> storage.upload("../outside.txt", new byte[0], "text/plain"))
                .isInstanceOf(StorageUploadException.class)
                .hasMessage("Refusing to write outside the storage root: ../outside.txt");
    }

    @Test
    void failedMoveLeavesNoTempFileBehind() throws Exception {
        FileSystemMediaStorage storage = new FileSystemMediaStorage(root, "http://localhost/media");
        Files.createDirectories(root.resolve("clip.mp4"));
        Files.writeString(root.resolve("clip.mp4/inside.txt"), "occupied");

        assertThatThrownBy(() -> storage.upload("clip.mp4", new byte[]{1, 2, 3}, "video/mp4"))
                .isInstanceOf(StorageUploadException.class)
                .hasMessageStartingWith("Failed to store clip.mp4");

        try (var files = Files.list(root)) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("clip.mp4");
        }
    }
}
