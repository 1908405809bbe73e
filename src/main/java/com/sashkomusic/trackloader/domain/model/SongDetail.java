package com.sashkomusic.trackloader.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Catalog record for one matched song. The catalog returns {@code album} either as a plain
 * string or as an object with a {@code name}, so it is kept as a raw node.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SongDetail(
        String id,
        String name,
        String year,
        String language,
        String label,
        String copyright,
        String url,
        Integer duration,
        SongArtists artists,
        JsonNode album,
        List<AssetLink> downloadUrl,
        List<ImageLink> image
) {
    public SongDetail {
        artists = artists != null ? artists : SongArtists.empty();
        downloadUrl = downloadUrl != null ? List.copyOf(downloadUrl) : List.of();
        image = image != null ? List.copyOf(image) : List.of();
    }
}
