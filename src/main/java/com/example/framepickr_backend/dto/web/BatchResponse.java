package com.example.framepickr_backend.dto.web;

import java.util.List;

/**
 * Response of the scoring endpoints. All lists are always present, even when some uploads failed.
 */
public record BatchResponse(int count,
                            List<CandidateView> top,
                            List<CandidateView> all,
                            List<ErrorView> errors,
                            List<SavedView> saved) {
}
