package net.albumart.service.artwork;

import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Optional;

/**
 * Cached outcome of one external lookup. A no-match entry carries no URL and is kept
 * exactly as long as a match would be.
 *
 * @param imageUrl resolved high-resolution URL, {@code null} for the no-match sentinel
 * @param resolvedAt when the lookup completed
 */
public record ArtworkCacheEntry(String imageUrl, Instant resolvedAt) {

    public ArtworkCacheEntry {
        imageUrl = StringUtils.hasText(imageUrl) ? imageUrl : null;
    }

    public static ArtworkCacheEntry match(String imageUrl, Instant resolvedAt) {
        if (!StringUtils.hasText(imageUrl)) {
            throw new IllegalArgumentException("A matched artwork entry requires an image URL");
        }
        return new ArtworkCacheEntry(imageUrl, resolvedAt);
    }

    public static ArtworkCacheEntry noMatch(Instant resolvedAt) {
        return new ArtworkCacheEntry(null, resolvedAt);
    }

    public boolean isNoMatch() {
        return imageUrl == null;
    }

    public Optional<String> url() {
        return Optional.ofNullable(imageUrl);
    }
}
