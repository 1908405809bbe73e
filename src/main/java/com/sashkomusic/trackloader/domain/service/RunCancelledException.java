package com.sashkomusic.trackloader.domain.service;

import com.sashkomusic.trackloader.domain.model.RunStatistics;
import lombok.Getter;

/**
 * Raised by {@link TrackOrchestrator} after a cancelled run has drained. The statistics
 * include the tracks that finished during the drain and those that never started.
 */
@Getter
public class RunCancelledException extends RuntimeException {

    private final transient RunStatistics statistics;

    public RunCancelledException(RunStatistics statistics, Throwable cause) {
        super("Run cancelled: " + statistics.getCancelled() + " pending track(s) dropped", cause);
        this.statistics = statistics;
    }
}
