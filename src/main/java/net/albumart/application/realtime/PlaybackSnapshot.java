package net.albumart.application.realtime;

import net.albumart.model.CanonicalTrack;

import java.time.Instant;

/**
 * The single current track together with its publish version.
 *
 * @param version incremented on every published change, starting at 0
 * @param track current track, {@code null} when nothing is playing
 * @param lastUpdated when the published state last changed
 */
public record PlaybackSnapshot(long version, CanonicalTrack track, Instant lastUpdated) {

    static PlaybackSnapshot initial(Instant now) {
        return new PlaybackSnapshot(0L, null, now);
    }

    PlaybackSnapshot next(CanonicalTrack nextTrack, Instant now) {
        return new PlaybackSnapshot(version + 1, nextTrack, now);
    }

    /**
     * Same version and change time, fresher position data.
     */
    PlaybackSnapshot refreshed(CanonicalTrack refreshedTrack) {
        return new PlaybackSnapshot(version, refreshedTrack, lastUpdated);
    }
}
