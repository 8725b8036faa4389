package com.example.framepickr_backend.detection;

import com.example.framepickr_backend.metrics.LumaImage;

import java.util.List;

/**
 * Pretrained detector that finds regions matching one pattern (face, eye, smile).
 * Implementations must be safe to call from several threads at once.
 */
@FunctionalInterface
public interface RegionDetector {

    /**
     * @param image luma plane to scan.
     * @return detected regions in {@code image} coordinates; never {@code null}.
     */
    List<Region> detect(LumaImage image);
}
