package net.albumart.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One upcoming entry of the speaker queue, rebuilt on every poll cycle.
 *
 * @param title track title
 * @param artist track artist
 * @param album album name
 * @param nativeArtUrl artwork URL as reported by the device
 * @param resolvedDisplayUrl artwork URL the display should prefetch
 * @param hasExternalMatch whether the resolved URL came from the external lookup
 * @param matchReason diagnostic reason produced by the artwork resolver
 */
public record QueueItem(
    String title,
    String artist,
    String album,

    @JsonProperty("native_art_url")
    String nativeArtUrl,

    @JsonProperty("resolved_display_url")
    String resolvedDisplayUrl,

    @JsonProperty("has_external_match")
    boolean hasExternalMatch,

    @JsonProperty("match_reason")
    String matchReason
) {
    public QueueItem {
        title = title == null ? "" : title;
        artist = artist == null ? "" : artist;
        album = album == null ? "" : album;
    }
}
