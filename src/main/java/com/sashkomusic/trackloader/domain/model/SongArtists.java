package com.sashkomusic.trackloader.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SongArtists(
        List<ArtistCredit> primary,
        List<ArtistCredit> all
) {
    public SongArtists {
        primary = primary != null ? List.copyOf(primary) : List.of();
        all = all != null ? List.copyOf(all) : List.of();
    }

    public static SongArtists empty() {
        return new SongArtists(List.of(), List.of());
    }
}
