package com.example.framepickr_backend.service;

import com.example.framepickr_backend.config.WorkerExecutorProperties;
import com.example.framepickr_backend.exception.BatchCancelledException;
import com.example.framepickr_backend.metrics.MetricExtractor;
import com.example.framepickr_backend.model.ImageCandidate;
import com.example.framepickr_backend.model.MetricSet;
import com.example.framepickr_backend.model.PersistOutcome;
import com.example.framepickr_backend.model.ScoredCandidate;
import com.example.framepickr_backend.model.SelectionResult;
import com.example.framepickr_backend.preprocess.ImagePreprocessor;
import com.example.framepickr_backend.preprocess.PreprocessResult;
import com.example.framepickr_backend.scoring.ScoreCombiner;
import com.example.framepickr_backend.selector.ImageSelector;
import com.example.framepickr_backend.selector.Ranking;
import com.example.framepickr_backend.util.CandidateState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Drives one batch: preprocess and score every candidate on the scoring pool, rank once all of
 * them are done, then persist the selection.
 *
 * <p>Per-candidate problems never escape as exceptions; they end up as FAILED candidates in
 * {@link SelectionResult#errors()}. Each task writes its result into its own slot exactly once.</p>
 */
@Service
public class SelectionOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SelectionOrchestrator.class);

    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_SCORING_FAILED = "scoring_failed";
    static final String REASON_CANCELLED = "cancelled";
    static final String REASON_REJECTED = "rejected";

    private final ImagePreprocessor preprocessor;
    private final MetricExtractor extractor;
    private final ScoreCombiner combiner;
    private final ImageSelector selector;
    private final ImagePersister persister;
    private final AsyncTaskExecutor scoringExecutor;
    private final Duration batchTimeout;

    public SelectionOrchestrator(ImagePreprocessor preprocessor,
                                 MetricExtractor extractor,
                                 ScoreCombiner combiner,
                                 ImageSelector selector,
                                 ImagePersister persister,
                                 @Qualifier("scoringTaskExecutor") AsyncTaskExecutor scoringExecutor,
                                 WorkerExecutorProperties properties) {
        this.preprocessor = preprocessor;
        this.extractor = extractor;
        this.combiner = combiner;
        this.selector = selector;
        this.persister = persister;
        this.scoringExecutor = scoringExecutor;
        this.batchTimeout = properties.getBatchTimeout() == null ? Duration.ofSeconds(60) : properties.getBatchTimeout();
    }

    /**
     * Scores the batch, selects the best {@code topN} and writes them to storage.
     */
    public SelectionResult scoreAndSave(List<ImageCandidate> batch, int topN) {
        return run(batch, topN, true);
    }

    /**
     * Scores and ranks the batch without persisting anything.
     */
    public SelectionResult scoreOnly(List<ImageCandidate> batch, int topN) {
        return run(batch, topN, false);
    }

    private SelectionResult run(List<ImageCandidate> batch, int topN, boolean persist) {
        if (batch == null) {
            throw new IllegalArgumentException("batch is required");
        }
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1");
        }
        requireDistinctIndexes(batch);
        if (batch.isEmpty()) {
            LOGGER.info("SelectionOrchestrator empty batch");
            return SelectionResult.empty();
        }

        long started = System.nanoTime();
        LOGGER.info("SelectionOrchestrator START count={} topN={} persist={}", batch.size(), topN, persist);

        List<ScoredCandidate> scored = scoreAll(batch);
        Ranking ranking = selector.rank(scored, topN);
        List<ScoredCandidate> errors = scored.stream().filter(c -> !c.isOk()).toList();

        Set<Integer> selected = new HashSet<>();
        ranking.top().forEach(c -> selected.add(c.index()));
        for (ScoredCandidate c : ranking.all()) {
            transition(c.index(), CandidateState.SCORED, selected.contains(c.index()) ? CandidateState.SELECTED : CandidateState.DISCARDED);
        }

        Map<Integer, PersistOutcome> saved = Map.of();
        if (persist) {
            saved = persister.persist(ranking.top());
            saved.forEach((index, outcome) ->
                    transition(index, CandidateState.SELECTED, outcome.succeeded() ? CandidateState.PERSISTED : CandidateState.PERSIST_FAILED));
        }

        long persistFailed = saved.values().stream().filter(o -> !o.succeeded()).count();
        LOGGER.info("SelectionOrchestrator DONE count={} ok={} failed={} top={} saved={} persistFailed={} tookMs={}",
                batch.size(), ranking.all().size(), errors.size(), ranking.top().size(),
                saved.size() - persistFailed, persistFailed, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return new SelectionResult(batch.size(), ranking.all(), ranking.top(), errors, saved);
    }

    private List<ScoredCandidate> scoreAll(List<ImageCandidate> batch) {
        AtomicReferenceArray<ScoredCandidate> slots = new AtomicReferenceArray<>(batch.size());
        List<Future<?>> futures = new ArrayList<>(batch.size());
        int rejected = 0;
        for (int i = 0; i < batch.size(); i++) {
            int slot = i;
            ImageCandidate candidate = batch.get(i);
            try {
                futures.add(scoringExecutor.submit(() -> slots.compareAndSet(slot, null, scoreOne(candidate))));
            } catch (RejectedExecutionException e) {
                // scoring pool saturated
                if (slots.compareAndSet(slot, null, ScoredCandidate.failed(candidate, REASON_REJECTED))) {
                    transition(candidate.index(), CandidateState.RECEIVED, CandidateState.FAILED);
                }
                futures.add(CompletableFuture.completedFuture(null));
                rejected++;
            }
        }
        if (rejected > 0) {
            LOGGER.warn("SelectionOrchestrator scoring pool full; rejected={} of count={}", rejected, batch.size());
        }

        boolean timedOut = false;
        long deadline = System.nanoTime() + batchTimeout.toNanos();
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                timedOut = true;
                break;
            } catch (ExecutionException | CancellationException e) {
                LOGGER.warn("Scoring task ended abnormally index={} cause={}", batch.get(i).index(), e.toString());
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new BatchCancelledException("Batch of " + batch.size() + " abandoned while scoring", e);
            }
        }

        // unfinished slots are claimed before any task is cancelled
        List<ScoredCandidate> scored = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            ImageCandidate candidate = batch.get(i);
            String reason = timedOut ? REASON_TIMEOUT : REASON_SCORING_FAILED;
            if (slots.compareAndSet(i, null, ScoredCandidate.failed(candidate, reason))) {
                transition(candidate.index(), CandidateState.RECEIVED, CandidateState.FAILED);
            }
            scored.add(slots.get(i));
        }
        if (timedOut) {
            LOGGER.warn("SelectionOrchestrator timeout after {} ms; cancelling unfinished candidates", batchTimeout.toMillis());
            futures.forEach(f -> f.cancel(true));
        }
        return scored;
    }

    ScoredCandidate scoreOne(ImageCandidate candidate) {
        try {
            PreprocessResult pre = preprocessor.normalize(candidate);
            if (!pre.isOk()) {
                transition(candidate.index(), CandidateState.RECEIVED, CandidateState.FAILED);
                return ScoredCandidate.failed(candidate, pre.failure().reason());
            }
            transition(candidate.index(), CandidateState.RECEIVED, CandidateState.PREPROCESSED);
            if (Thread.currentThread().isInterrupted()) {
                transition(candidate.index(), CandidateState.PREPROCESSED, CandidateState.FAILED);
                return ScoredCandidate.failed(candidate, REASON_CANCELLED);
            }

            MetricSet metrics = extractor.extract(pre.image());
            double score = combiner.score(metrics);
            transition(candidate.index(), CandidateState.PREPROCESSED, CandidateState.SCORED);
            LOGGER.debug("Scored index={} file={} score={} metrics={} resized={}",
                    candidate.index(), candidate.filename(), score, metrics, pre.transformed());
            return ScoredCandidate.ok(candidate, pre.image(), metrics, score);
        } catch (RuntimeException e) {
            LOGGER.warn("Scoring failed index={} file={}", candidate.index(), candidate.filename(), e);
            return ScoredCandidate.failed(candidate, REASON_SCORING_FAILED);
        }
    }

    private static void transition(int index, CandidateState from, CandidateState to) {
        if (!from.canMoveTo(to)) {
            throw new IllegalStateException("Illegal candidate transition " + from + " -> " + to + " index=" + index);
        }
        LOGGER.trace("Candidate index={} {} -> {}", index, from, to);
    }

    private static void requireDistinctIndexes(List<ImageCandidate> batch) {
        Set<Integer> seen = new HashSet<>();
        for (ImageCandidate c : batch) {
            if (c == null) {
                throw new IllegalArgumentException("batch contains a null candidate");
            }
            if (!seen.add(c.index())) {
                throw new IllegalArgumentException("duplicate candidate index " + c.index());
            }
        }
    }
}
