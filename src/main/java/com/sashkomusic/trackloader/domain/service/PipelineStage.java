package com.sashkomusic.trackloader.domain.service;

public enum PipelineStage {
    MATCH("match"),
    DETAIL("detail"),
    SELECT_ASSET("select asset"),
    TRANSFER("transfer"),
    TRANSCODE("transcode");

    private final String displayName;

    PipelineStage(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
