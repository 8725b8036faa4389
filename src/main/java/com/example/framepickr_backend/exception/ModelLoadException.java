package com.example.framepickr_backend.exception;

/**
 * A detector model could not be loaded. Fatal: the service must not start without its models.
 */
public class ModelLoadException extends RuntimeException {
    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
