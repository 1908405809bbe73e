package com.sashkomusic.trackloader.domain.service;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips video decorations from source titles so they can be used as catalog queries,
 * e.g. {@code "Song Title (Official Video) [HD]"} becomes {@code "Song Title"}.
 */
@Service
public class TitleNormalizer {

    private static final List<Pattern> DECORATIONS = List.of(
            Pattern.compile("\\(Official.*?\\)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[Official.*?]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\(Audio\\)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[Audio]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\(Lyric.*?\\)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[Lyric.*?]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\(.*?Video\\)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[.*?Video]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("[(\\[]\\s*(HD|HQ|4K)\\s*[)\\]]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bHD\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bHQ\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b4K\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\|.*$"),
            Pattern.compile("\\(\\s*\\)|\\[\\s*]")
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_HYPHENS = Pattern.compile("(\\s*-)+\\s*$");

    public String normalize(String title) {
        if (title == null) {
            return "";
        }

        // Removing one decoration can expose another, so repeat until nothing changes.
        String current = title;
        String previous;
        do {
            previous = current;
            current = normalizeOnce(current);
        } while (!current.equals(previous));

        return current;
    }

    private String normalizeOnce(String title) {
        String cleaned = title;
        for (Pattern decoration : DECORATIONS) {
            cleaned = decoration.matcher(cleaned).replaceAll("");
        }

        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        return TRAILING_HYPHENS.matcher(cleaned).replaceAll("");
    }
}
