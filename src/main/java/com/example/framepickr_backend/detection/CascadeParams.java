package com.example.framepickr_backend.detection;

/**
 * Tuning for one {@code detectMultiScale} call.
 *
 * @param scaleFactor  pyramid step between scales, {@code > 1}.
 * @param minNeighbors neighbouring hits required to keep a candidate.
 * @param minSize      smallest square region considered, in pixels.
 */
public record CascadeParams(double scaleFactor, int minNeighbors, int minSize) {

    public CascadeParams {
        if (!(scaleFactor > 1.0)) {
            throw new IllegalArgumentException("scaleFactor must be > 1");
        }
        if (minNeighbors < 0 || minSize < 0) {
            throw new IllegalArgumentException("minNeighbors and minSize must be >= 0");
        }
    }
}
