package net.albumart.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Display modes a client cycles through, in cycle order.
 *
 * <p>Each mode carries an availability predicate over the current track. The transition
 * function skips modes whose predicate fails, so callers never special-case individual modes.</p>
 */
public enum DisplayMode {
    ON("on", track -> true),
    DETAILED("detailed", track -> true),
    COMPARISON("comparison", track -> track != null && track.hasOriginalNativeArt()),
    DEBUG("debug", track -> track != null && track.hasUpcomingQueue()),
    OFF("off", track -> true);

    private final String wireValue;
    private final Predicate<CanonicalTrack> availability;

    DisplayMode(String wireValue, Predicate<CanonicalTrack> availability) {
        this.wireValue = wireValue;
        this.availability = availability;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isAvailableFor(CanonicalTrack track) {
        return availability.test(track);
    }

    /**
     * Returns the mode following this one whose availability predicate holds for {@code track}.
     * Falls back to this mode when no other mode is available.
     */
    public DisplayMode next(CanonicalTrack track) {
        DisplayMode[] modes = values();
        for (int step = 1; step < modes.length; step++) {
            DisplayMode candidate = modes[(ordinal() + step) % modes.length];
            if (candidate.isAvailableFor(track)) {
                return candidate;
            }
        }
        return this;
    }

    public static List<DisplayMode> availableFor(CanonicalTrack track) {
        return Arrays.stream(values())
            .filter(mode -> mode.isAvailableFor(track))
            .toList();
    }

    public static Optional<DisplayMode> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(mode -> mode.wireValue.equals(normalized))
            .findFirst();
    }
}
