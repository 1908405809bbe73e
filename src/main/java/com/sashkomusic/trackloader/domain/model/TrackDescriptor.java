package com.sashkomusic.trackloader.domain.model;

public record TrackDescriptor(
        String title,
        String uploader,
        String sourceId
) {
    public TrackDescriptor {
        title = title != null ? title : "";
        uploader = uploader != null ? uploader : "";
        sourceId = sourceId != null ? sourceId : "";
    }

    public String displayLabel() {
        return title.isBlank() ? "Unknown" : title;
    }
}
