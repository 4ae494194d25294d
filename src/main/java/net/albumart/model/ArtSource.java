/**
 * Album artwork provenance
 */
package net.albumart.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the artwork shown for a track came from
 * - NATIVE: the URL reported by the playback device (usually low resolution)
 * - EXTERNAL: a higher resolution URL from the artwork lookup service
 * - NONE: neither source produced a URL
 */
public enum ArtSource {
    NATIVE("native"),
    EXTERNAL("external"),
    NONE("none");

    private final String wireValue;

    ArtSource(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
