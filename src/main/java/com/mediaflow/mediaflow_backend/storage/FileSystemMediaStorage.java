package com.mediaflow.mediaflow_backend.storage;

import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes media below {@code mediaflow.storage.root}. Files are served at
 * {@code mediaflow.storage.public-base-url}.
 */
@Slf4j
@Component
public class FileSystemMediaStorage implements MediaStorage {

    private final Path root;
    private final String publicBaseUrl;

    @Autowired
    public FileSystemMediaStorage(MediaflowProperties properties) {
        this(Path.of(properties.getStorage().getRoot()), properties.getStorage().getPublicBaseUrl());
    }

    public FileSystemMediaStorage(Path root, String publicBaseUrl) {
        this.root = root.toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.endsWith("/") ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
    }

    @Override
    public String upload(String path, byte[] bytes, String contentType) {
        Path target = root.resolve(path).normalize();
        if (!target.startsWith(root)) {
            throw new StorageUploadException("Refusing to write outside the storage root: " + path);
        }
        Path temp = null;
        boolean moved = false;
        try {
            Files.createDirectories(target.getParent());
            // write then move so readers never see a partial file
            temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            moved = true;
        } catch (IOException e) {
            throw new StorageUploadException("Failed to store " + path + ": " + e.getMessage(), e);
        } finally {
            if (temp != null && !moved) {
                deleteQuietly(temp);
            }
        }
        log.debug("[Storage] Stored {} ({} bytes, {})", path, bytes.length, contentType);
        return publicBaseUrl + "/" + path;
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[Storage] Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
