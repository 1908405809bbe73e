package com.sashkomusic.trackloader.domain.model;

public record TagSet(
        String title,
        String artist,
        String album,
        String year,
        String albumArtist,
        String language,
        String composers,
        String label,
        String copyright,
        String url,
        Integer durationSeconds,
        String durationText,
        String coverImageUrl
) {
}
