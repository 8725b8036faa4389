package com.example.framepickr_backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one batch: ranking, selection, failures and persisted locators.
 *
 * @param count  number of submitted candidates.
 * @param all    OK candidates in rank order.
 * @param top    prefix of {@code all} that was selected.
 * @param errors FAILED candidates in submission order.
 * @param saved  persist outcome per selected candidate index; empty when nothing was persisted.
 */
public record SelectionResult(int count,
                              List<ScoredCandidate> all,
                              List<ScoredCandidate> top,
                              List<ScoredCandidate> errors,
                              Map<Integer, PersistOutcome> saved) {

    public SelectionResult {
        all = List.copyOf(all);
        top = List.copyOf(top);
        errors = List.copyOf(errors);
        saved = Collections.unmodifiableMap(new LinkedHashMap<>(saved));
        if (top.size() > all.size() || !all.subList(0, top.size()).equals(top)) {
            throw new IllegalArgumentException("top must be a prefix of all");
        }
    }

    public static SelectionResult empty() {
        return new SelectionResult(0, List.of(), List.of(), List.of(), Map.of());
    }

    public PersistOutcome savedFor(ScoredCandidate candidate) {
        return saved.get(candidate.index());
    }
}
