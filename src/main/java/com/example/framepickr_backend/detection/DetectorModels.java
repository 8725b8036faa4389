package com.example.framepickr_backend.detection;

import java.util.Objects;

/**
 * The three detectors used for metric extraction. Built once at startup and shared read-only.
 */
public final class DetectorModels {
    private final RegionDetector face;
    private final RegionDetector eye;
    private final RegionDetector smile;

    public DetectorModels(RegionDetector face, RegionDetector eye, RegionDetector smile) {
        this.face = Objects.requireNonNull(face, "face detector");
        this.eye = Objects.requireNonNull(eye, "eye detector");
        this.smile = Objects.requireNonNull(smile, "smile detector");
    }

    public RegionDetector face() {
        return face;
    }

    public RegionDetector eye() {
        return eye;
    }

    public RegionDetector smile() {
        return smile;
    }
}
