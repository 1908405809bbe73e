package com.sashkomusic.trackloader.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sashkomusic.trackloader.domain.model.ArtistCredit;
import com.sashkomusic.trackloader.domain.model.SongDetail;
import com.sashkomusic.trackloader.domain.model.TagSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class MetadataProjector {

    static final String UNKNOWN_ARTIST = "Unknown";
    private static final Set<String> ALBUM_ARTIST_ROLES = Set.of("music", "composer");
    private static final String LYRICIST_ROLE = "lyricist";

    private final AssetSelector assetSelector;

    public TagSet project(SongDetail detail) {
        String artist = primaryArtists(detail);
        String albumArtist = joinNames(detail.artists().all().stream()
                .filter(credit -> credit.role() != null && ALBUM_ARTIST_ROLES.contains(credit.role()))
                .toList());
        String composers = joinNames(detail.artists().all().stream()
                .filter(credit -> LYRICIST_ROLE.equals(credit.role()))
                .toList());

        return new TagSet(
                detail.name(),
                artist,
                albumName(detail.album()),
                detail.year(),
                albumArtist.isEmpty() ? artist : albumArtist,
                titleCase(detail.language()),
                composers.isEmpty() ? null : composers,
                detail.label(),
                detail.copyright(),
                detail.url(),
                detail.duration(),
                detail.duration() != null ? formatDuration(detail.duration()) : null,
                assetSelector.selectCover(detail.image()).orElse(null)
        );
    }

    /**
     * Comma-joined primary artist names, or {@code "Unknown"} when the catalog lists none.
     */
    public String primaryArtists(SongDetail detail) {
        String names = joinNames(detail.artists().primary());
        return names.isEmpty() ? UNKNOWN_ARTIST : names;
    }

    static String formatDuration(int seconds) {
        return String.format("%d:%02d", seconds / 60, seconds % 60);
    }

    static String titleCase(String value) {
        if (value == null) {
            return null;
        }

        StringBuilder result = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (char c : value.toCharArray()) {
            if (Character.isLetter(c)) {
                result.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                result.append(c);
                startOfWord = true;
            }
        }
        return result.toString();
    }

    private String albumName(JsonNode album) {
        if (album == null || album.isNull() || album.isMissingNode()) {
            return null;
        }
        if (album.isObject()) {
            JsonNode name = album.get("name");
            return name != null && !name.isNull() ? name.asText() : null;
        }
        return album.asText();
    }

    private String joinNames(List<ArtistCredit> credits) {
        return credits.stream()
                .map(credit -> credit.name() != null ? credit.name() : "")
                .collect(Collectors.joining(", "));
    }
}
