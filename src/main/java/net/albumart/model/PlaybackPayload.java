package net.albumart.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Wire payload of {@code state} and {@code update} stream events and of {@code GET /api/state}.
 *
 * @param currentTrack the current track, or {@code null} when nothing is playing
 * @param lastUpdated when the published state last changed; omitted on stream events
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record PlaybackPayload(
    @JsonProperty("current_track")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    CanonicalTrack currentTrack,

    @JsonProperty("last_updated")
    Instant lastUpdated
) {
    public static PlaybackPayload streamEvent(CanonicalTrack currentTrack) {
        return new PlaybackPayload(currentTrack, null);
    }

    public static PlaybackPayload stateView(CanonicalTrack currentTrack, Instant lastUpdated) {
        return new PlaybackPayload(currentTrack, lastUpdated);
    }
}
