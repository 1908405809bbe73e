package com.sashkomusic.trackloader.domain.model;

import java.nio.file.Path;

public record TrackOutcome(
        Status status,
        String label,
        String reason,
        Path file
) {
    public enum Status {
        SUCCESS,
        SKIPPED_EXISTING,
        FAILED,
        CANCELLED
    }

    public static TrackOutcome success(String label, Path file) {
        return new TrackOutcome(Status.SUCCESS, label, null, file);
    }

    public static TrackOutcome skippedExisting(String label, Path file) {
        return new TrackOutcome(Status.SKIPPED_EXISTING, label, null, file);
    }

    public static TrackOutcome failed(String label, String reason) {
        return new TrackOutcome(Status.FAILED, label, reason, null);
    }

    public static TrackOutcome cancelled(String label) {
        return new TrackOutcome(Status.CANCELLED, label, null, null);
    }
}
