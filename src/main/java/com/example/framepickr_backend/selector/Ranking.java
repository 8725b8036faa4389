package com.example.framepickr_backend.selector;

import com.example.framepickr_backend.model.ScoredCandidate;

import java.util.List;

/**
 * OK candidates in rank order plus the selected prefix.
 *
 * @param all ranked OK candidates.
 * @param top first {@code min(topN, all.size())} entries of {@code all}.
 */
public record Ranking(List<ScoredCandidate> all, List<ScoredCandidate> top) {
    public Ranking {
        all = List.copyOf(all);
        top = List.copyOf(top);
    }
}
