package com.example.framepickr_backend.model;

/**
 * Objective quality metrics for one image.
 *
 * @param sharpness  Laplacian variance of the luma channel, {@code >= 0}.
 * @param brightness mean luma in {@code [0,255]}.
 * @param faceCount  non-overlapping face regions.
 * @param eyeCount   eyes found inside face regions.
 * @param smileCount smiles found inside face regions.
 */
public record MetricSet(double sharpness, double brightness, int faceCount, int eyeCount, int smileCount) {

    public MetricSet {
        if (faceCount < 0 || eyeCount < 0 || smileCount < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
    }

    public static MetricSet empty() {
        return new MetricSet(0, 0, 0, 0, 0);
    }
}
