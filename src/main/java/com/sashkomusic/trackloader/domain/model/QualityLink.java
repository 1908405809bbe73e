package com.sashkomusic.trackloader.domain.model;

/**
 * A quality-tagged URL as returned by the catalog for audio and artwork variants.
 */
public interface QualityLink {

    String quality();

    String url();
}
