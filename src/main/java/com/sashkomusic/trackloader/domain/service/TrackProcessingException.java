package com.sashkomusic.trackloader.domain.service;

import lombok.Getter;

@Getter
public class TrackProcessingException extends RuntimeException {

    private final PipelineStage stage;

    public TrackProcessingException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public TrackProcessingException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String reason() {
        return stage.displayName() + ": " + getMessage();
    }
}
