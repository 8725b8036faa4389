package com.example.framepickr_backend.model;

/**
 * Result of writing one selected image. Exactly one of {@code locator} and {@code error} is set.
 *
 * @param storedName name the image was stored under.
 * @param locator    path or URL returned by the store.
 * @param error      failure reason when the write failed.
 */
public record PersistOutcome(String storedName, String locator, String error) {

    public static PersistOutcome stored(String storedName, String locator) {
        return new PersistOutcome(storedName, locator, null);
    }

    public static PersistOutcome failed(String storedName, String error) {
        return new PersistOutcome(storedName, null, error == null ? "persist_failed" : error);
    }

    public boolean succeeded() {
        return locator != null;
    }
}
