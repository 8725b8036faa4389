package com.example.framepickr_backend.selector;

import com.example.framepickr_backend.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Default selector: highest score first, submission order breaks ties.
 */
@Component
public class ScoreRankingSelector implements ImageSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScoreRankingSelector.class);

    private static final Comparator<ScoredCandidate> RANK_ORDER = Comparator
            .comparingDouble(ScoredCandidate::score).reversed()
            .thenComparingInt(ScoredCandidate::index);

    @Override
    public Ranking rank(List<ScoredCandidate> candidates, int topN) {
        List<ScoredCandidate> ranked = new ArrayList<>();
        int skipped = 0;
        for (ScoredCandidate candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            if (!candidate.isOk()) {
                skipped++;
                LOGGER.trace("selector skip index={} file={} reason={}", candidate.index(), candidate.filename(), candidate.failureReason());
                continue;
            }
            ranked.add(candidate);
        }

        ranked.sort(RANK_ORDER);
        int limit = ranked.isEmpty() ? 0 : Math.min(Math.max(1, topN), ranked.size());
        List<ScoredCandidate> top = ranked.subList(0, limit);

        LOGGER.debug("ScoreRankingSelector candidates={} ranked={} skipped={} selected={} topScore={}",
                candidates.size(), ranked.size(), skipped, top.size(),
                top.isEmpty() ? "-" : String.format(Locale.ROOT, "%.3f", top.get(0).score()));
        return new Ranking(ranked, top);
    }
}
