package com.example.framepickr_backend.util;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one candidate inside a batch.
 */
public enum CandidateState {
    RECEIVED,
    PREPROCESSED,
    SCORED,
    SELECTED,
    DISCARDED,
    PERSISTED,
    PERSIST_FAILED,
    FAILED;

    public boolean isTerminal() {
        return this == DISCARDED || this == PERSISTED || this == PERSIST_FAILED || this == FAILED;
    }

    public boolean canMoveTo(CandidateState next) {
        return allowedNext().contains(next);
    }

    private Set<CandidateState> allowedNext() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(PREPROCESSED, FAILED);
            case PREPROCESSED -> EnumSet.of(SCORED, FAILED);
            case SCORED -> EnumSet.of(SELECTED, DISCARDED);
            case SELECTED -> EnumSet.of(PERSISTED, PERSIST_FAILED);
            default -> EnumSet.noneOf(CandidateState.class);
        };
    }
}
