package com.sashkomusic.trackloader.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageLink(
        String quality,
        String url
) implements QualityLink {
}
