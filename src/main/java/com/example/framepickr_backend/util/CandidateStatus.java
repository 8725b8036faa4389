package com.example.framepickr_backend.util;

/**
 * Outcome of scoring a single candidate.
 */
public enum CandidateStatus {
    OK,
    FAILED
}
