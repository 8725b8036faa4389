package com.example.framepickr_backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateStateTest {

    @Test
    void happyPathIsAllowed() {
        assertThat(CandidateState.RECEIVED.canMoveTo(CandidateState.PREPROCESSED)).isTrue();
        assertThat(CandidateState.PREPROCESSED.canMoveTo(CandidateState.SCORED)).isTrue();
        assertThat(CandidateState.SCORED.canMoveTo(CandidateState.SELECTED)).isTrue();
        assertThat(CandidateState.SELECTED.canMoveTo(CandidateState.PERSISTED)).isTrue();
    }

    @Test
    void scoredCandidatesCannotFail() {
        assertThat(CandidateState.SCORED.canMoveTo(CandidateState.FAILED)).isFalse();
        assertThat(CandidateState.DISCARDED.canMoveTo(CandidateState.PERSISTED)).isFalse();
        assertThat(CandidateState.RECEIVED.canMoveTo(CandidateState.SCORED)).isFalse();
    }

    @Test
    void terminalStatesGoNowhere() {
        for (CandidateState state : CandidateState.values()) {
            if (state.isTerminal()) {
                for (CandidateState next : CandidateState.values()) {
                    assertThat(state.canMoveTo(next)).as("%s -> %s", state, next).isFalse();
                }
            }
        }
        assertThat(CandidateState.PERSIST_FAILED.isTerminal()).isTrue();
        assertThat(CandidateState.SELECTED.isTerminal()).isFalse();
    }
}
