package com.example.framepickr_backend.util;

import com.example.framepickr_backend.dto.web.BatchResponse;
import com.example.framepickr_backend.dto.web.CandidateView;
import com.example.framepickr_backend.dto.web.ErrorView;
import com.example.framepickr_backend.dto.web.SavedView;
import com.example.framepickr_backend.model.MetricSet;
import com.example.framepickr_backend.model.PersistOutcome;
import com.example.framepickr_backend.model.ScoredCandidate;
import com.example.framepickr_backend.model.SelectionResult;

import java.util.ArrayList;
import java.util.List;

public final class BatchResponseMapper {

    private BatchResponseMapper() {
    }

    public static BatchResponse toResponse(SelectionResult result) {
        List<CandidateView> top = result.top().stream().map(c -> toView(c, result.savedFor(c))).toList();
        List<CandidateView> all = result.all().stream().map(c -> toView(c, result.savedFor(c))).toList();
        List<ErrorView> errors = result.errors().stream()
                .map(c -> new ErrorView(c.filename(), c.failureReason()))
                .toList();

        List<SavedView> saved = new ArrayList<>();
        for (ScoredCandidate c : result.top()) {
            PersistOutcome outcome = result.savedFor(c);
            if (outcome != null && outcome.succeeded()) {
                saved.add(new SavedView(c.filename(), outcome.storedName(), outcome.locator(), round3(c.score())));
            }
        }
        return new BatchResponse(result.count(), top, all, errors, saved);
    }

    static CandidateView toView(ScoredCandidate c, PersistOutcome outcome) {
        MetricSet m = c.metrics() == null ? MetricSet.empty() : c.metrics();
        int width = c.image() == null ? 0 : c.image().width();
        int height = c.image() == null ? 0 : c.image().height();
        return new CandidateView(
                c.filename(),
                outcome == null ? null : outcome.locator(),
                round3(c.score()),
                round3(m.sharpness()),
                round3(m.brightness()),
                m.faceCount(),
                m.eyeCount(),
                m.smileCount(),
                outcome == null ? null : outcome.storedName(),
                outcome == null ? null : outcome.error(),
                width,
                height);
    }

    static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
