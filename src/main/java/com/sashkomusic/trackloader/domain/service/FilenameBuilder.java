package com.sashkomusic.trackloader.domain.service;

import com.sashkomusic.trackloader.domain.model.SongDetail;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Derives the on-disk base name {@code "<title> - <artists>"} for a matched song.
 * Two songs that reduce to the same name share one output file.
 */
@Service
@RequiredArgsConstructor
public class FilenameBuilder {

    static final int MAX_LENGTH = 200;

    private final MetadataProjector metadataProjector;

    public String baseName(SongDetail detail) {
        String title = detail.name() != null ? detail.name() : "Unknown";
        return sanitize(title + " - " + metadataProjector.primaryArtists(detail));
    }

    static String sanitize(String filename) {
        // Remove illegal characters for filesystems: < > : " / \ | ? *
        String stripped = filename.replaceAll("[<>:\"/\\\\|?*]", "");
        // Count code points so a surrogate pair is never split.
        if (stripped.codePointCount(0, stripped.length()) > MAX_LENGTH) {
            stripped = stripped.substring(0, stripped.offsetByCodePoints(0, MAX_LENGTH));
        }
        return stripped.trim();
    }
}
