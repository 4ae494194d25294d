package net.albumart.service.artwork;

import net.albumart.model.ArtSource;
import org.springframework.util.StringUtils;

/**
 * Artwork chosen for one (artist, album, native art) request.
 *
 * @param displayUrl URL to show, {@code null} when neither source has one
 * @param source provenance of {@code displayUrl}
 * @param reason human-readable diagnostic
 */
public record ArtworkResolution(String displayUrl, ArtSource source, String reason) {

    public static final String REASON_DISABLED = "disabled";
    public static final String REASON_NO_METADATA = "no metadata";
    public static final String REASON_GATE_CLOSED = "rate-limited, using native";
    public static final String REASON_CACHED = "cached";
    public static final String REASON_MATCHED = "matched";
    public static final String REASON_NO_ALBUM_MATCH = "no album match";
    public static final String REASON_RATE_LIMITED = "rate-limited";
    public static final String REASON_THROTTLED = "throttled";
    public static final String REASON_LOOKUP_ERROR = "lookup error";

    public static ArtworkResolution external(String imageUrl, String reason) {
        return new ArtworkResolution(imageUrl, ArtSource.EXTERNAL, reason);
    }

    /**
     * Falls back to the device's own artwork, or to {@link ArtSource#NONE} when it has none.
     */
    public static ArtworkResolution nativeArt(String nativeArtUrl, String reason) {
        if (StringUtils.hasText(nativeArtUrl)) {
            return new ArtworkResolution(nativeArtUrl, ArtSource.NATIVE, reason);
        }
        return new ArtworkResolution(null, ArtSource.NONE, reason);
    }

    public boolean isExternal() {
        return source == ArtSource.EXTERNAL;
    }
}
