package com.mediaflow.mediaflow_backend.storage;

/** Durable object storage for generated media. */
public interface MediaStorage {

    /**
     * Stores {@code bytes} under {@code path} and returns a stable public URL.
     *
     * @throws StorageUploadException if the object could not be written
     */
    String upload(String path, byte[] bytes, String contentType);
}
