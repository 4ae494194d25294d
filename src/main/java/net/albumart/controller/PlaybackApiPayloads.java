package net.albumart.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import net.albumart.model.DisplayMode;

import java.util.List;

/**
 * Response bodies of the playback REST endpoints.
 */
final class PlaybackApiPayloads {

    private PlaybackApiPayloads() {
    }

    record SourceStatus(String name, boolean available) {
    }

    record SourcesResponse(List<SourceStatus> sources) {
    }

    record DisplayConfig(
        @JsonProperty("default_mode") DisplayMode defaultMode,
        @JsonProperty("available_modes") List<DisplayMode> availableModes
    ) {
    }

    record ConfigResponse(DisplayConfig display) {
    }

    record CacheInvalidationResponse(String scope, long removed) {
    }

    record CacheStatsResponse(
        long entries,
        long hits,
        long misses,
        @JsonProperty("hit_rate") double hitRate,
        long evictions
    ) {
    }
}
