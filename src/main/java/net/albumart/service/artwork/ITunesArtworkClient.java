/**
 * iTunes Search API client for high-resolution album artwork
 *
 * Features:
 * - Queries the album entity with artist and album as combined search terms
 * - Rewrites the 100px thumbnail URL to the configured edge length
 * - Reports HTTP 403/429 as rate limiting and an exhausted local request budget as throttling
 * - Bounds each call with the configured lookup timeout
 * - Never throws: transport and parsing failures become {@link ArtworkLookupResult.Status#ERROR}
 */
package net.albumart.service.artwork;

import io.github.resilience4j.ratelimiter.RateLimiter;
import net.albumart.config.AlbumArtProperties;
import net.albumart.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class ITunesArtworkClient implements ArtworkLookupClient {

    private static final Logger logger = LoggerFactory.getLogger(ITunesArtworkClient.class);
    private static final String API_NAME = "iTunes";
    private static final Pattern THUMBNAIL_SIZE = Pattern.compile("(\\d+)x(\\d+)bb");

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Duration lookupTimeout;

    public ITunesArtworkClient(WebClient.Builder webClientBuilder,
                               AlbumArtProperties properties,
                               RateLimiter itunesArtworkRateLimiter,
                               ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.baseUrl(properties.getArtwork().getSearchUrl()).build();
        this.rateLimiter = itunesArtworkRateLimiter;
        this.objectMapper = objectMapper;
        this.lookupTimeout = properties.getArtwork().getLookupTimeout();
    }

    @Override
    public String name() {
        return API_NAME;
    }

    @Override
    public ArtworkLookupResult lookup(String artist, String album, int maxImageSize) {
        String term = buildSearchTerm(artist, album);
        if (!rateLimiter.acquirePermission()) {
            ExternalApiLogger.logRateLimited(logger, API_NAME, term, "local request budget exhausted");
            return ArtworkLookupResult.throttled("local request budget exhausted");
        }

        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "SEARCH_ALBUM", term);
        try {
            String body = webClient.get()
                .uri(builder -> builder
                    .queryParam("term", "{term}")
                    .queryParam("entity", "album")
                    .queryParam("limit", 1)
                    .build(term))
                .retrieve()
                .bodyToMono(String.class)
                .block(lookupTimeout);
            ArtworkLookupResult result = parseSearchResponse(body, maxImageSize);
            ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "SEARCH_ALBUM", term,
                result.status() == ArtworkLookupResult.Status.CANDIDATE ? 1 : 0);
            return result;
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 429 || status == 403) {
                ExternalApiLogger.logRateLimited(logger, API_NAME, term, "HTTP " + status);
                return ArtworkLookupResult.rateLimited("HTTP " + status);
            }
            ExternalApiLogger.logApiCallFailure(logger, API_NAME, "SEARCH_ALBUM", term, "HTTP " + status);
            return ArtworkLookupResult.error("HTTP " + status);
        } catch (JacksonException e) {
            ExternalApiLogger.logApiCallFailure(logger, API_NAME, "SEARCH_ALBUM", term, "malformed response: " + e.getOriginalMessage());
            return ArtworkLookupResult.error("malformed response");
        } catch (RuntimeException e) {
            // WebClientException: connection failures; IllegalStateException: timeout from block();
            // anything else reactor propagates still must not escape a lookup
            ExternalApiLogger.logApiCallFailure(logger, API_NAME, "SEARCH_ALBUM", term, describe(e));
            return ArtworkLookupResult.error(describe(e));
        }
    }

    ArtworkLookupResult parseSearchResponse(String body, int maxImageSize) {
        if (!StringUtils.hasText(body)) {
            return ArtworkLookupResult.error("empty response body");
        }
        JsonNode root = objectMapper.readTree(body);
        JsonNode results = root.path("results");
        if (root.path("resultCount").asInt(0) == 0 || !results.isArray() || results.isEmpty()) {
            return ArtworkLookupResult.noResult();
        }

        JsonNode first = results.get(0);
        String thumbnailUrl = first.path("artworkUrl100").asString("");
        if (!StringUtils.hasText(thumbnailUrl)) {
            return ArtworkLookupResult.noResult();
        }

        Matcher matcher = THUMBNAIL_SIZE.matcher(thumbnailUrl);
        String imageUrl = thumbnailUrl;
        int edge = 100;
        if (matcher.find()) {
            imageUrl = thumbnailUrl.substring(0, matcher.start())
                + maxImageSize + "x" + maxImageSize + "bb"
                + thumbnailUrl.substring(matcher.end());
            edge = maxImageSize;
        }

        return ArtworkLookupResult.candidate(new ArtworkCandidate(
            first.path("artistName").asString(""),
            first.path("collectionName").asString(""),
            imageUrl,
            edge,
            edge
        ));
    }

    private static String buildSearchTerm(String artist, String album) {
        String safeArtist = artist == null ? "" : artist.trim();
        String safeAlbum = album == null ? "" : album.trim();
        return (safeArtist + " " + safeAlbum).trim();
    }

    private static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return root.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
