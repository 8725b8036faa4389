package com.example.framepickr_backend.util;

import com.example.framepickr_backend.dto.web.BatchResponse;
import com.example.framepickr_backend.model.ImageCandidate;
import com.example.framepickr_backend.model.MetricSet;
import com.example.framepickr_backend.model.PersistOutcome;
import com.example.framepickr_backend.model.ScoredCandidate;
import com.example.framepickr_backend.model.SelectionResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BatchResponseMapperTest {

    private static ScoredCandidate ok(int index, double score) {
        return ScoredCandidate.ok(new ImageCandidate(index, "img" + index + ".jpg", null, new byte[]{1}),
                null, new MetricSet(10, 120, 0, 0, 0), score);
    }

    @Test
    void failedWritesAreReportedOnTheCandidateButNotAsSaved() {
        ScoredCandidate first = ok(0, 1.5);
        ScoredCandidate second = ok(1, 1.2);
        Map<Integer, PersistOutcome> saved = new LinkedHashMap<>();
        saved.put(0, PersistOutcome.stored("img0-a.jpg", "/uploads/img0-a.jpg"));
        saved.put(1, PersistOutcome.failed("img1-b.jpg", "disk full"));
        SelectionResult result = new SelectionResult(2, List.of(first, second), List.of(first, second), List.of(), saved);

        BatchResponse response = BatchResponseMapper.toResponse(result);

        assertThat(response.saved()).singleElement().satisfies(s -> {
            assertThat(s.savedAs()).isEqualTo("img0-a.jpg");
            assertThat(s.url()).isEqualTo("/uploads/img0-a.jpg");
        });
        assertThat(response.top().get(1).persistError()).isEqualTo("disk full");
        assertThat(response.top().get(1).locator()).isNull();
        assertThat(response.top().get(0).width()).isZero();
    }

    @Test
    void roundsToThreeDecimals() {
        assertThat(BatchResponseMapper.round3(0.12345)).isEqualTo(0.123);
        assertThat(BatchResponseMapper.round3(1.23456)).isEqualTo(1.235);
    }
}
