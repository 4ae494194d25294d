package net.albumart.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Normalized "what is playing now" snapshot published to display clients.
 *
 * <p>Independent of the device API that produced it. At most one instance is current at any
 * time; when {@code isPlaying} is false the position and duration are carried for display
 * but flagged as not authoritative.</p>
 *
 * @param source playback source name (for example {@code sonos})
 * @param title track title, empty when the device reports none
 * @param artist track artist, empty when unknown
 * @param album album name, empty when unknown
 * @param isPlaying whether the device transport is currently playing
 * @param positionMs playback position in milliseconds, never negative
 * @param durationMs track duration in milliseconds, {@code 0} when unknown
 * @param albumArtUrl artwork URL the display should show
 * @param artSource provenance of {@code albumArtUrl}
 * @param artSourceReason diagnostic reason from artwork resolution
 * @param originalNativeArtUrl device artwork URL, present only when external art replaced it
 * @param roomName speaker room name, optional
 * @param timestamp when the device state was observed
 * @param upcomingQueueItems upcoming queue entries in playback order
 */
public record CanonicalTrack(
    String source,
    String title,
    String artist,
    String album,

    @JsonProperty("is_playing")
    boolean isPlaying,

    @JsonProperty("position_ms")
    long positionMs,

    @JsonProperty("duration_ms")
    long durationMs,

    @JsonProperty("album_art_url")
    String albumArtUrl,

    @JsonProperty("art_source")
    ArtSource artSource,

    @JsonProperty("art_source_reason")
    String artSourceReason,

    @JsonProperty("original_native_art_url")
    String originalNativeArtUrl,

    @JsonProperty("room_name")
    String roomName,

    Instant timestamp,

    @JsonProperty("upcoming_queue_items")
    List<QueueItem> upcomingQueueItems
) {
    public CanonicalTrack {
        title = title == null ? "" : title;
        artist = artist == null ? "" : artist;
        album = album == null ? "" : album;
        positionMs = Math.max(0L, positionMs);
        durationMs = Math.max(0L, durationMs);
        artSource = artSource == null ? ArtSource.NONE : artSource;
        originalNativeArtUrl = StringUtils.hasText(originalNativeArtUrl) ? originalNativeArtUrl : null;
        roomName = StringUtils.hasText(roomName) ? roomName : null;
        upcomingQueueItems = upcomingQueueItems == null ? List.of() : List.copyOf(upcomingQueueItems);
    }

    /**
     * Position and duration are only authoritative while the transport is playing.
     */
    @JsonProperty(value = "position_authoritative", access = JsonProperty.Access.READ_ONLY)
    public boolean positionAuthoritative() {
        return isPlaying;
    }

    /**
     * Resolved artwork URLs of the upcoming queue, in order and without duplicates,
     * so the display can warm its image cache before the track changes.
     */
    @JsonProperty(value = "upcoming_art_urls", access = JsonProperty.Access.READ_ONLY)
    public List<String> upcomingArtUrls() {
        return upcomingQueueItems.stream()
            .map(QueueItem::resolvedDisplayUrl)
            .filter(StringUtils::hasText)
            .filter(url -> !Objects.equals(url, albumArtUrl))
            .distinct()
            .toList();
    }

    public boolean hasUpcomingQueue() {
        return !upcomingQueueItems.isEmpty();
    }

    public boolean hasOriginalNativeArt() {
        return originalNativeArtUrl != null;
    }
}
