package com.example.framepickr_backend.support;

import com.example.framepickr_backend.detection.DetectorModels;
import com.example.framepickr_backend.detection.Region;
import com.example.framepickr_backend.detection.RegionDetector;

import java.util.List;

public final class FakeDetectors {

    private FakeDetectors() {
    }

    public static RegionDetector none() {
        return image -> List.of();
    }

    public static RegionDetector fixed(Region... regions) {
        List<Region> found = List.of(regions);
        return image -> found;
    }

    public static DetectorModels noFaces() {
        return new DetectorModels(none(), none(), none());
    }

    /** Waits {@code millis} per call; returns early with no detections when interrupted. */
    public static RegionDetector slow(long millis) {
        return image -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
    }
}
