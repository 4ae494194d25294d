/**
 * Administrative operations on the artwork cache
 *
 * Features:
 * - Drops every cached match and no-match so the next poll looks artwork up again
 * - Drops a single (artist, album) entry when both parameters are given
 * - Reports entry count, hit and miss counts, and size-bound evictions
 */
package net.albumart.controller;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import net.albumart.service.artwork.ArtworkCache;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/artwork")
@Slf4j
public class ArtworkCacheAdminController {

    private final ArtworkCache artworkCache;

    public ArtworkCacheAdminController(ArtworkCache artworkCache) {
        this.artworkCache = artworkCache;
    }

    @GetMapping(value = "/cache", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PlaybackApiPayloads.CacheStatsResponse> stats() {
        CacheStats stats = artworkCache.stats();
        return ResponseEntity.ok(new PlaybackApiPayloads.CacheStatsResponse(
            artworkCache.size(),
            stats.hitCount(),
            stats.missCount(),
            stats.hitRate(),
            stats.evictionCount()
        ));
    }

    /**
     * Invalidates cached artwork resolutions.
     *
     * @param artist artist of the single entry to drop; requires {@code album}
     * @param album album of the single entry to drop; requires {@code artist}
     * @return the invalidation scope and the number of entries removed
     */
    @DeleteMapping(value = "/cache", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PlaybackApiPayloads.CacheInvalidationResponse> invalidate(
            @RequestParam(required = false) String artist,
            @RequestParam(required = false) String album) {
        boolean hasArtist = StringUtils.hasText(artist);
        boolean hasAlbum = StringUtils.hasText(album);
        if (hasArtist != hasAlbum) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "artist and album must be given together");
        }
        if (hasArtist) {
            boolean removed = artworkCache.invalidate(artist, album);
            return ResponseEntity.ok(new PlaybackApiPayloads.CacheInvalidationResponse("entry", removed ? 1 : 0));
        }
        long removed = artworkCache.invalidateAll();
        log.info("Artwork cache cleared through admin endpoint");
        return ResponseEntity.ok(new PlaybackApiPayloads.CacheInvalidationResponse("all", removed));
    }
}
