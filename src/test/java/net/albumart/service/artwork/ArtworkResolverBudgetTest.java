package net.albumart.service.artwork;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import net.albumart.config.AlbumArtProperties;
import net.albumart.config.CacheFactory;
import net.albumart.model.ArtSource;
import net.albumart.testutil.MutableClock;
import net.albumart.testutil.StubExchanges;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Resolver wired to the real iTunes client, with only one request permitted per minute.
 */
class ArtworkResolverBudgetTest {

    private static final String NATIVE_ART = "http://192.168.1.20:1400/getaa?s=1&u=x-sonos-spotify";
    private static final String WALL_RESPONSE = """
        {"resultCount":1,"results":[{"artistName":"Pink Floyd","collectionName":"The Wall",
          "artworkUrl100":"https://is1-ssl.mzstatic.com/image/thumb/Music/v4/wall/100x100bb.jpg"}]}
        """;

    private StubExchanges.Recording exchange;
    private RateLimitGate gate;
    private ArtworkResolver resolver;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        AlbumArtProperties properties = new AlbumArtProperties();
        properties.getArtwork().setSearchUrl("https://itunes.example/search");
        properties.getArtwork().setLookupTimeout(Duration.ofMillis(500));
        properties.getArtwork().setCooldown(Duration.ofSeconds(60));

        RateLimiter onePerMinute = RateLimiter.of("itunes", RateLimiterConfig.custom()
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .limitForPeriod(1)
            .timeoutDuration(Duration.ZERO)
            .build());
        exchange = new StubExchanges.Recording(request ->
            Mono.just(StubExchanges.response(HttpStatus.OK, "text/javascript; charset=utf-8", WALL_RESPONSE)));
        ITunesArtworkClient client = new ITunesArtworkClient(
            WebClient.builder().exchangeFunction(exchange), properties, onePerMinute, JsonMapper.builder().build());

        gate = new RateLimitGate(clock);
        resolver = new ArtworkResolver(client,
            new ArtworkCache(new CacheFactory().createCacheWithSize(100), clock), gate, properties);
    }

    @Test
    void should_KeepServingCachedArt_When_BudgetSpentOnAnotherAlbum() {
        ArtworkResolution matched = resolver.resolve("Pink Floyd", "The Wall", NATIVE_ART);
        ArtworkResolution deferred = resolver.resolve("Radiohead", "OK Computer", NATIVE_ART);
        ArtworkResolution again = resolver.resolve("Pink Floyd", "The Wall", NATIVE_ART);

        assertThat(matched.reason()).isEqualTo("matched");
        assertThat(deferred.reason()).isEqualTo("throttled");
        assertThat(deferred.source()).isEqualTo(ArtSource.NATIVE);
        assertThat(again.source()).isEqualTo(ArtSource.EXTERNAL);
        assertThat(again.reason()).isEqualTo("cached");
        assertThat(gate.isBlocked()).isFalse();
        assertThat(exchange.requests()).hasSize(1);
    }
}
