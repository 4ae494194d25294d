/**
 * Chooses the artwork shown for a track
 *
 * Features:
 * - Prefers a validated high-resolution external match over the device's native art
 * - Requires both artist AND album to match; an artist-only match is rejected
 * - Memoizes matches and no-matches alike so a pair is looked up at most once per process
 * - Honors the rate-limit cooldown gate before touching the external service
 * - Never throws: every failure degrades to native art with a diagnostic reason
 */
package net.albumart.service.artwork;

import net.albumart.config.AlbumArtProperties;
import net.albumart.util.ExternalApiLogger;
import net.albumart.util.MetadataNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Service
public class ArtworkResolver {

    private static final Logger logger = LoggerFactory.getLogger(ArtworkResolver.class);

    private final ArtworkLookupClient lookupClient;
    private final ArtworkCache cache;
    private final RateLimitGate rateLimitGate;
    private final boolean externalLookupEnabled;
    private final int maxImageSize;
    private final Duration cooldown;

    public ArtworkResolver(ArtworkLookupClient lookupClient,
                           ArtworkCache cache,
                           RateLimitGate rateLimitGate,
                           AlbumArtProperties properties) {
        this.lookupClient = lookupClient;
        this.cache = cache;
        this.rateLimitGate = rateLimitGate;
        this.externalLookupEnabled = properties.getArtwork().isExternalLookupEnabled();
        this.maxImageSize = properties.getArtwork().getMaxImageSize();
        this.cooldown = properties.getArtwork().getCooldown();
    }

    /**
     * Resolves the display artwork for a track or queue entry.
     *
     * @param artist reported artist, may be empty
     * @param album reported album, may be empty
     * @param nativeArtUrl artwork URL reported by the device, may be {@code null}
     * @return the chosen URL, its source and the reason
     */
    public ArtworkResolution resolve(String artist, String album, String nativeArtUrl) {
        if (!externalLookupEnabled) {
            return ArtworkResolution.nativeArt(nativeArtUrl, ArtworkResolution.REASON_DISABLED);
        }
        if (MetadataNormalizer.isBlank(artist) && MetadataNormalizer.isBlank(album)) {
            return ArtworkResolution.nativeArt(nativeArtUrl, ArtworkResolution.REASON_NO_METADATA);
        }
        ArtworkKey key = ArtworkKey.of(artist, album);
        if (rateLimitGate.isBlocked()) {
            ExternalApiLogger.logCooldownSkip(logger, lookupClient.name(), key.toString(), rateLimitGate.remaining().toSeconds());
            return ArtworkResolution.nativeArt(nativeArtUrl, ArtworkResolution.REASON_GATE_CLOSED);
        }

        Optional<ArtworkCacheEntry> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get().url()
                .map(url -> ArtworkResolution.external(url, ArtworkResolution.REASON_CACHED))
                .orElseGet(() -> ArtworkResolution.nativeArt(nativeArtUrl, ArtworkResolution.REASON_CACHED));
        }

        ArtworkLookupResult result = lookupClient.lookup(artist, album, maxImageSize);
        switch (result.status()) {
            case CANDIDATE:
                return acceptOrReject(key, artist, album, result.candidate(), nativeArtUrl);
            case NO_RESULT:
                cache.recordNoMatch(key);
                logger.debug("No artwork result for {}; caching no-match", key);
                return ArtworkResolution.nativeArt(nativeArtUrl, ArtworkResolution.REASON_NO_ALBUM_MATCH);
            case RATE_LIMITED:
                Instant reopensAt = rateLimitGate.blockFor(cooldown);
                logger.warn("Artwork lookup rate limited ({}); external lookups paused until {}", result.detail(), reopensAt);
                return ArtworkResolution.nativeArt(nativeArtUrl, ArtworkResolution.REASON_RATE_LIMITED);
            case THROTTLED:
                // Our own budget: the service never refused us, so the cooldown gate stays open
                logger.debug("Artwork lookup for {} deferred: {}", key, result.detail());
                return ArtworkResolution.nativeArt(nativeArtUrl, ArtworkResolution.REASON_THROTTLED);
            case ERROR:
            default:
                logger.debug("Artwork lookup failed for {}: {}", key, result.detail());
                return ArtworkResolution.nativeArt(nativeArtUrl, ArtworkResolution.REASON_LOOKUP_ERROR);
        }
    }

    private ArtworkResolution acceptOrReject(ArtworkKey key,
                                             String artist,
                                             String album,
                                             ArtworkCandidate candidate,
                                             String nativeArtUrl) {
        if (matchesQuery(candidate, artist, album)) {
            cache.recordMatch(key, candidate.imageUrl());
            logger.info("Artwork matched for {} ({}x{})", key, candidate.width(), candidate.height());
            return ArtworkResolution.external(candidate.imageUrl(), ArtworkResolution.REASON_MATCHED);
        }
        cache.recordNoMatch(key);
        logger.info("Rejected artwork candidate '{}' / '{}' for {}; caching no-match",
            candidate.artist(), candidate.album(), key);
        return ArtworkResolution.nativeArt(nativeArtUrl, ArtworkResolution.REASON_NO_ALBUM_MATCH);
    }

    static boolean matchesQuery(ArtworkCandidate candidate, String artist, String album) {
        if (candidate == null || candidate.imageUrl() == null || candidate.imageUrl().isBlank()) {
            return false;
        }
        return MetadataNormalizer.sameValue(candidate.artist(), artist)
            && MetadataNormalizer.sameValue(candidate.album(), album);
    }
}
