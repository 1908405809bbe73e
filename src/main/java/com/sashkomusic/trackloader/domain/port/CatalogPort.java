package com.sashkomusic.trackloader.domain.port;

import com.sashkomusic.trackloader.domain.model.SearchCandidate;
import com.sashkomusic.trackloader.domain.model.SongDetail;

import java.util.Optional;

/**
 * Search and detail lookups against the song catalog. Implementations are shared by all
 * workers and must be safe for concurrent use.
 */
public interface CatalogPort {

    Optional<SearchCandidate> search(String query);

    Optional<SongDetail> fetchDetail(String id);
}
