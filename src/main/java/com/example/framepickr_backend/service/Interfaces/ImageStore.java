package com.example.framepickr_backend.service.Interfaces;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Backend that keeps selected images and hands out locators for them.
 */
public interface ImageStore {

    /**
     * Writes {@code bytes} under {@code storedName}.
     *
     * @return locator for the written object: a relative path or an absolute URL.
     * @throws com.example.framepickr_backend.exception.StorageException when the write fails.
     */
    String store(byte[] bytes, String storedName, String contentType);

    /** Local file for a stored name; only filesystem backends have one. */
    default Optional<Path> resolve(String storedName) {
        return Optional.empty();
    }
}
