package com.example.framepickr_backend.model;

import com.example.framepickr_backend.util.CandidateStatus;

/**
 * A candidate after the scoring phase. FAILED instances carry no metrics and no image.
 *
 * @param index         submission index of the candidate.
 * @param filename      original filename.
 * @param metrics       extracted metrics, {@code null} when failed.
 * @param score         combined score, {@code 0} when failed.
 * @param status        OK or FAILED.
 * @param failureReason short machine readable reason when failed.
 * @param image         normalized image that was scored, {@code null} when failed.
 */
public record ScoredCandidate(int index,
                              String filename,
                              MetricSet metrics,
                              double score,
                              CandidateStatus status,
                              String failureReason,
                              NormalizedImage image) {

    public static ScoredCandidate ok(ImageCandidate candidate, NormalizedImage image, MetricSet metrics, double score) {
        return new ScoredCandidate(candidate.index(), candidate.filename(), metrics, score, CandidateStatus.OK, null, image);
    }

    public static ScoredCandidate failed(ImageCandidate candidate, String reason) {
        return new ScoredCandidate(candidate.index(), candidate.filename(), null, 0.0, CandidateStatus.FAILED, reason, null);
    }

    public boolean isOk() {
        return status == CandidateStatus.OK;
    }
}
