package net.albumart.application.playback;

import net.albumart.model.CanonicalTrack;
import net.albumart.model.QueueItem;
import net.albumart.service.artwork.ArtworkResolution;
import net.albumart.service.artwork.ArtworkResolver;
import net.albumart.service.device.DevicePlaybackInfo;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Turns raw device state into the {@link CanonicalTrack} published to display clients,
 * resolving artwork for the current track on the way.
 */
@Component
public class TrackNormalizer {

    private final ArtworkResolver artworkResolver;
    private final Clock clock;

    public TrackNormalizer(ArtworkResolver artworkResolver, Clock clock) {
        this.artworkResolver = artworkResolver;
        this.clock = clock;
    }

    public CanonicalTrack normalize(String source, DevicePlaybackInfo info, List<QueueItem> upcoming) {
        ArtworkResolution artwork = artworkResolver.resolve(info.artist(), info.album(), info.nativeArtUrl());
        return new CanonicalTrack(
            source,
            info.title().trim(),
            info.artist().trim(),
            info.album().trim(),
            info.playing(),
            info.positionMs(),
            info.durationMs(),
            artwork.displayUrl(),
            artwork.source(),
            artwork.reason(),
            // Only kept when external art replaced it, for side-by-side comparison
            artwork.isExternal() ? info.nativeArtUrl() : null,
            info.roomName(),
            clock.instant(),
            upcoming
        );
    }
}
