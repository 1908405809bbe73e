package com.sashkomusic.trackloader.domain.service;

import com.sashkomusic.trackloader.config.WorkerPoolFactory;
import com.sashkomusic.trackloader.domain.model.RunStatistics;
import com.sashkomusic.trackloader.domain.model.TrackDescriptor;
import com.sashkomusic.trackloader.domain.model.TrackOutcome;
import com.sashkomusic.trackloader.domain.port.TrackSourcePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans a track list out over a fixed-size worker pool and folds the outcomes into
 * {@link RunStatistics} in completion order.
 * <p>
 * Only the calling thread touches the statistics. Interrupting that thread cancels the run:
 * tracks that have not started are dropped and recorded as cancelled, tracks already running
 * are allowed to finish, and then {@link RunCancelledException} is thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackOrchestrator {

    private final TrackSourcePort trackSource;
    private final TrackPipeline trackPipeline;
    private final WorkerPoolFactory workerPoolFactory;
    private final RunReportBuilder reportBuilder;

    public RunStatistics processUrl(String url, Path outputDir, int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be positive, got " + workerCount);
        }

        log.info("Extracting metadata from: {}", url);
        List<TrackDescriptor> tracks = trackSource.extractTracks(url);
        if (Thread.interrupted()) {
            RunStatistics stats = new RunStatistics(tracks.size());
            tracks.forEach(track -> stats.recordCancelled(track.displayLabel()));
            throw new RunCancelledException(stats, new InterruptedException("Cancelled during extraction"));
        }
        if (tracks.isEmpty()) {
            log.warn("Could not extract any tracks from URL");
            RunStatistics empty = RunStatistics.empty();
            log.info("\n{}", reportBuilder.build(empty));
            return empty;
        }

        log.info("Processing {} track(s) with {} parallel workers", tracks.size(), workerCount);
        RunStatistics stats = new RunStatistics(tracks.size());
        ThreadPoolTaskExecutor pool = workerPoolFactory.create(workerCount);
        try {
            runAll(tracks, outputDir, pool, stats);
        } finally {
            pool.shutdown();
        }

        log.info("\n{}", reportBuilder.build(stats));
        return stats;
    }

    private void runAll(List<TrackDescriptor> tracks, Path outputDir, ThreadPoolTaskExecutor pool,
                        RunStatistics stats) {
        CompletionService<TrackOutcome> completion = new ExecutorCompletionService<>(pool.getThreadPoolExecutor());
        Map<Future<TrackOutcome>, TrackSubmission> submissions = new LinkedHashMap<>();

        int ordinal = 0;
        for (TrackDescriptor track : tracks) {
            TrackSubmission submission = new TrackSubmission(++ordinal, track);
            submissions.put(completion.submit(() -> execute(submission, outputDir, tracks.size())), submission);
        }

        Set<Future<TrackOutcome>> outstanding = new HashSet<>(submissions.keySet());
        try {
            while (!outstanding.isEmpty()) {
                fold(completion.take(), outstanding, submissions, stats);
            }
        } catch (InterruptedException ex) {
            log.info("Cancellation received! Finishing current downloads, cancelling pending tasks...");
            cancelPending(outstanding, submissions, stats);
            log.info("Cancelled {} pending tasks, waiting for {} running task(s) to complete...",
                    stats.getCancelled(), outstanding.size());
            drain(completion, outstanding, submissions, stats);
            log.info("\n{}", reportBuilder.build(stats));
            throw new RunCancelledException(stats, ex);
        }
    }

    private TrackOutcome execute(TrackSubmission submission, Path outputDir, int total) {
        if (!submission.claim()) {
            return TrackOutcome.cancelled(submission.label());
        }
        log.debug("[{}/{}] Started: {}", submission.ordinal(), total, submission.label());
        return trackPipeline.process(submission.track(), outputDir);
    }

    private void cancelPending(Set<Future<TrackOutcome>> outstanding,
                               Map<Future<TrackOutcome>, TrackSubmission> submissions, RunStatistics stats) {
        // Walk in submission order so cancelled labels keep input order.
        for (Map.Entry<Future<TrackOutcome>, TrackSubmission> entry : submissions.entrySet()) {
            Future<TrackOutcome> future = entry.getKey();
            TrackSubmission submission = entry.getValue();
            if (outstanding.contains(future) && submission.claim()) {
                future.cancel(false);
                outstanding.remove(future);
                stats.recordCancelled(submission.label());
            }
        }
    }

    private void drain(CompletionService<TrackOutcome> completion, Set<Future<TrackOutcome>> outstanding,
                       Map<Future<TrackOutcome>, TrackSubmission> submissions, RunStatistics stats) {
        boolean interruptedAgain = false;
        while (!outstanding.isEmpty()) {
            try {
                fold(completion.take(), outstanding, submissions, stats);
            } catch (InterruptedException ex) {
                interruptedAgain = true;
                log.info("Already cancelling, still waiting for {} running task(s)", outstanding.size());
            }
        }
        if (interruptedAgain) {
            Thread.currentThread().interrupt();
        }
    }

    private void fold(Future<TrackOutcome> future, Set<Future<TrackOutcome>> outstanding,
                      Map<Future<TrackOutcome>, TrackSubmission> submissions, RunStatistics stats) {
        // Futures cancelled by cancelPending still pass through the completion queue.
        if (!outstanding.remove(future)) {
            return;
        }

        TrackSubmission submission = submissions.get(future);
        TrackOutcome outcome;
        try {
            outcome = future.get();
        } catch (ExecutionException ex) {
            log.error("[{}/{}] Exception: {}", submission.ordinal(), stats.getTotal(), ex.getCause().getMessage(), ex.getCause());
            outcome = TrackOutcome.failed(submission.label(), "unexpected error: " + ex.getCause().getMessage());
        } catch (InterruptedException ex) {
            // Unreachable in practice: the future came off the completion queue, so get() returns at once.
            outcome = TrackOutcome.failed(submission.label(), "interrupted");
        }

        stats.record(outcome);
        switch (outcome.status()) {
            case SUCCESS, SKIPPED_EXISTING -> log.info("[{}/{}] Completed successfully",
                    stats.getSucceeded(), stats.getTotal());
            case FAILED -> log.warn("[{}/{}] Failed to process: {} ({})",
                    submission.ordinal(), stats.getTotal(), submission.label(), outcome.reason());
            case CANCELLED -> log.info("[{}/{}] Cancelled before start: {}",
                    submission.ordinal(), stats.getTotal(), submission.label());
        }
    }

    /**
     * One queued track. Whichever of the worker and the canceller claims it first decides
     * whether it runs.
     */
    private static final class TrackSubmission {

        private final int ordinal;
        private final TrackDescriptor track;
        private final AtomicBoolean claimed = new AtomicBoolean(false);

        private TrackSubmission(int ordinal, TrackDescriptor track) {
            this.ordinal = ordinal;
            this.track = track;
        }

        boolean claim() {
            return claimed.compareAndSet(false, true);
        }

        int ordinal() {
            return ordinal;
        }

        TrackDescriptor track() {
            return track;
        }

        String label() {
            return track.displayLabel();
        }
    }
}
