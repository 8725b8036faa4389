package com.example.framepickr_backend.dto.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One ranked photo. {@code locator} and {@code persistedName} stay in the payload as null when
 * nothing was written; {@code persistError} appears only when a write failed.
 */
public record CandidateView(String filename,
                            String locator,
                            double score,
                            double sharpness,
                            double brightness,
                            int faceCount,
                            int eyeCount,
                            int smileCount,
                            String persistedName,
                            @JsonInclude(JsonInclude.Include.NON_NULL) String persistError,
                            int width,
                            int height) {
}
