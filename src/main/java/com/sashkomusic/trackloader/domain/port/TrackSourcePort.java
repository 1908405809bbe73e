package com.sashkomusic.trackloader.domain.port;

import com.sashkomusic.trackloader.domain.model.TrackDescriptor;

import java.util.List;

public interface TrackSourcePort {

    /**
     * Reads the ordered track list behind a playlist or single-video URL.
     *
     * @return the descriptors in source order, or an empty list if the URL could not be read
     */
    List<TrackDescriptor> extractTracks(String url);
}
