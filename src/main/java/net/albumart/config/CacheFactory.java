package net.albumart.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalListener;
import net.albumart.service.artwork.ArtworkCacheEntry;
import net.albumart.service.artwork.ArtworkKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Factory for creating Caffeine caches with consistent configuration.
 */
@Configuration
public class CacheFactory {

    private static final Logger logger = LoggerFactory.getLogger(CacheFactory.class);

    /**
     * Create a cache with size limit only (no TTL).
     */
    public <K, V> Cache<K, V> createCacheWithSize(int maxSize) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .recordStats()
            .build();
    }

    /**
     * Create a size-limited cache that reports every size-bound eviction to {@code evictionListener}.
     */
    public <K, V> Cache<K, V> createCacheWithSize(int maxSize, RemovalListener<K, V> evictionListener) {
        return Caffeine.newBuilder()
            .evictionListener(evictionListener)
            .maximumSize(maxSize)
            .recordStats()
            .build();
    }

    /**
     * Resolved artwork per normalized (artist, album). Catalog matches do not change, so
     * entries never expire; only the size bound and explicit invalidation remove them.
     * An evicted pair, no-match included, is looked up again the next time it plays.
     */
    @Bean
    public Cache<ArtworkKey, ArtworkCacheEntry> artworkResolutionCache(AlbumArtProperties properties) {
        int maximumSize = properties.getArtwork().getCacheMaximumSize();
        RemovalListener<ArtworkKey, ArtworkCacheEntry> logEviction = (key, entry, cause) ->
            logger.info("Evicted cached artwork for {} ({}, bound {}); it will be looked up again",
                key, entry != null && entry.isNoMatch() ? "no-match" : "match", maximumSize);
        return createCacheWithSize(maximumSize, logEviction);
    }
}
