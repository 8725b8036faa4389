package com.example.framepickr_backend.selector;

import com.example.framepickr_backend.model.ScoredCandidate;

import java.util.List;

/**
 * Ranks the scored candidates of one batch and picks the best ones.
 */
public interface ImageSelector {
    /**
     * Ranks OK candidates by score in descending order and selects the first {@code topN}.
     *
     * @param candidates every candidate of the batch, OK and FAILED, in any order.
     * @param topN       requested selection size; clamped to {@code [1, OK count]}.
     * @return ranking over OK candidates and its selected prefix.
     */
    Ranking rank(List<ScoredCandidate> candidates, int topN);
}
