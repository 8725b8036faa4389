package com.example.framepickr_backend.exception;

/**
 * Raised by an image store when a write or lookup fails.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
