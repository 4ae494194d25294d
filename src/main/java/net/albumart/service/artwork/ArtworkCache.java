/**
 * Process-wide memo of artwork lookups
 *
 * Features:
 * - Maps normalized (artist, album) to a resolved URL or an explicit no-match sentinel
 * - No expiry: catalog matches do not change, so entries live until restart or invalidation
 * - Per-key writes are atomic; concurrent readers never observe a partial entry
 * - Written only by {@link ArtworkResolver}; pollers and enrichers read through the resolver
 */
package net.albumart.service.artwork;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

@Component
@Slf4j
public class ArtworkCache {

    private final Cache<ArtworkKey, ArtworkCacheEntry> entries;
    private final Clock clock;

    public ArtworkCache(Cache<ArtworkKey, ArtworkCacheEntry> artworkResolutionCache, Clock clock) {
        this.entries = artworkResolutionCache;
        this.clock = clock;
    }

    public Optional<ArtworkCacheEntry> get(ArtworkKey key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    ArtworkCacheEntry recordMatch(ArtworkKey key, String imageUrl) {
        ArtworkCacheEntry entry = ArtworkCacheEntry.match(imageUrl, clock.instant());
        entries.asMap().put(key, entry);
        return entry;
    }

    ArtworkCacheEntry recordNoMatch(ArtworkKey key) {
        ArtworkCacheEntry entry = ArtworkCacheEntry.noMatch(clock.instant());
        entries.asMap().put(key, entry);
        return entry;
    }

    /**
     * @return whether an entry was removed
     */
    public boolean invalidate(String artist, String album) {
        ArtworkKey key = ArtworkKey.of(artist, album);
        boolean removed = entries.asMap().remove(key) != null;
        log.info("Invalidated cached artwork for {} (present={})", key, removed);
        return removed;
    }

    public long invalidateAll() {
        long removed = entries.estimatedSize();
        entries.invalidateAll();
        log.info("Invalidated all cached artwork ({} entries)", removed);
        return removed;
    }

    public long size() {
        return entries.estimatedSize();
    }

    public CacheStats stats() {
        return entries.stats();
    }
}
