package com.sashkomusic.trackloader.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtistCredit(
        String name,
        String role
) {
}
