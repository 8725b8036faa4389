package com.example.framepickr_backend.exception;

/**
 * The caller abandoned a batch while candidates were still being scored.
 */
public class BatchCancelledException extends RuntimeException {
    public BatchCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
