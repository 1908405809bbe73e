package com.sashkomusic.trackloader.domain.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate counts for one run. Not thread-safe: only the orchestrator's aggregation loop
 * writes to it, one outcome at a time.
 */
@Getter
public class RunStatistics {

    private final int total;
    private int succeeded;
    private int alreadyPresent;
    private final List<String> failedTracks = new ArrayList<>();
    private final List<String> cancelledTracks = new ArrayList<>();

    public RunStatistics(int total) {
        this.total = total;
    }

    public static RunStatistics empty() {
        return new RunStatistics(0);
    }

    public void record(TrackOutcome outcome) {
        switch (outcome.status()) {
            case SUCCESS -> succeeded++;
            case SKIPPED_EXISTING -> {
                succeeded++;
                alreadyPresent++;
            }
            case FAILED -> failedTracks.add(outcome.label());
            case CANCELLED -> cancelledTracks.add(outcome.label());
        }
    }

    public void recordCancelled(String label) {
        cancelledTracks.add(label);
    }

    public int getFailed() {
        return failedTracks.size();
    }

    public int getCancelled() {
        return cancelledTracks.size();
    }

    public int getAccounted() {
        return succeeded + getFailed() + getCancelled();
    }

    public boolean isQuiescent() {
        return getAccounted() == total;
    }

    public List<String> getFailedTracks() {
        return Collections.unmodifiableList(failedTracks);
    }

    public List<String> getCancelledTracks() {
        return Collections.unmodifiableList(cancelledTracks);
    }
}
