package com.sashkomusic.trackloader.domain.model;

public record SearchCandidate(String id) {
}
