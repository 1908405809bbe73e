package com.sashkomusic.trackloader.domain.service;

import com.sashkomusic.trackloader.domain.model.AssetLink;
import com.sashkomusic.trackloader.domain.model.ImageLink;
import com.sashkomusic.trackloader.domain.model.QualityLink;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Picks the download and artwork variants of a catalog song.
 * <p>
 * The preferred quality tag is searched explicitly and the first hit wins. Only when no
 * variant carries it does the selector fall back to the last entry, since the catalog
 * lists variants in ascending quality.
 */
@Service
public class AssetSelector {

    public static final String HIGHEST_AUDIO_QUALITY = "320kbps";
    public static final String PREFERRED_IMAGE_QUALITY = "500x500";

    public Optional<String> selectAudio(List<AssetLink> links) {
        return select(links, HIGHEST_AUDIO_QUALITY);
    }

    public Optional<String> selectCover(List<ImageLink> images) {
        return select(images, PREFERRED_IMAGE_QUALITY);
    }

    private Optional<String> select(List<? extends QualityLink> links, String preferredQuality) {
        if (links == null || links.isEmpty()) {
            return Optional.empty();
        }

        for (QualityLink link : links) {
            if (link != null && preferredQuality.equals(link.quality())) {
                return nonBlank(link.url());
            }
        }

        QualityLink last = links.get(links.size() - 1);
        return last != null ? nonBlank(last.url()) : Optional.empty();
    }

    private Optional<String> nonBlank(String url) {
        return url == null || url.isBlank() ? Optional.empty() : Optional.of(url);
    }
}
