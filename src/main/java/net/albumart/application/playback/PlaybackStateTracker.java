package net.albumart.application.playback;

import net.albumart.model.CanonicalTrack;

import java.util.Objects;

/**
 * Decides what a poll result means for subscribers.
 *
 * <p>Position and duration drift on every poll, so they never trigger a push on their own.
 * A failed or empty poll is tolerated for {@code graceCycles - 1} cycles before "nothing
 * playing" is published, which keeps a single network hiccup from blanking the display.</p>
 *
 * <p>Thread-safe; the poller is the only writer in practice.</p>
 */
public class PlaybackStateTracker {

    public enum Decision {
        /** Significant change: broadcast as an update. */
        PUBLISH,
        /** Same track, new position: refresh the snapshot without pushing. */
        REFRESH,
        /** Missing report inside the grace period: keep the last state. */
        HOLD,
        /** Nothing to do. */
        UNCHANGED
    }

    private final int graceCycles;
    private CanonicalTrack lastTrack;
    private int consecutiveMisses;

    public PlaybackStateTracker(int graceCycles) {
        if (graceCycles < 1) {
            throw new IllegalArgumentException("graceCycles must be at least 1");
        }
        this.graceCycles = graceCycles;
    }

    /**
     * Records one poll result.
     *
     * @param track the normalized track, or {@code null} when the device failed or reported nothing
     */
    public synchronized Decision offer(CanonicalTrack track) {
        if (track == null) {
            if (lastTrack == null) {
                consecutiveMisses = 0;
                return Decision.UNCHANGED;
            }
            consecutiveMisses++;
            if (consecutiveMisses < graceCycles) {
                return Decision.HOLD;
            }
            lastTrack = null;
            consecutiveMisses = 0;
            return Decision.PUBLISH;
        }

        consecutiveMisses = 0;
        CanonicalTrack previous = lastTrack;
        lastTrack = track;
        if (isSignificantChange(previous, track)) {
            return Decision.PUBLISH;
        }
        return Decision.REFRESH;
    }

    public synchronized CanonicalTrack lastTrack() {
        return lastTrack;
    }

    public synchronized int consecutiveMisses() {
        return consecutiveMisses;
    }

    /**
     * Identity, playback flag and resolved artwork; position and duration are ignored.
     */
    static boolean isSignificantChange(CanonicalTrack previous, CanonicalTrack next) {
        if (previous == null || next == null) {
            return previous != next;
        }
        return !Objects.equals(previous.title(), next.title())
            || !Objects.equals(previous.artist(), next.artist())
            || !Objects.equals(previous.album(), next.album())
            || previous.isPlaying() != next.isPlaying()
            || !Objects.equals(previous.albumArtUrl(), next.albumArtUrl());
    }
}
