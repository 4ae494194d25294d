package net.albumart.model;

import net.albumart.testutil.TrackFixtures;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalTrackTest {

    private final JsonMapper jsonMapper = JsonMapper.builder().build();

    @Test
    void should_UseSnakeCaseWireNames_When_Serialized() {
        CanonicalTrack track = TrackFixtures.withExternalArt(
            TrackFixtures.playing("Mother", "Pink Floyd", "The Wall", "http://speaker:1400/art/mother"),
            "https://img.example/wall.jpg", "http://speaker:1400/art/mother");

        JsonNode json = jsonMapper.valueToTree(track);

        assertThat(json.get("is_playing").asBoolean()).isTrue();
        assertThat(json.get("position_ms").asLong()).isEqualTo(30_000L);
        assertThat(json.get("album_art_url").asString()).isEqualTo("https://img.example/wall.jpg");
        assertThat(json.get("art_source").asString()).isEqualTo("external");
        assertThat(json.get("original_native_art_url").asString()).isEqualTo("http://speaker:1400/art/mother");
        assertThat(json.get("position_authoritative").asBoolean()).isTrue();
        assertThat(json.has("upcoming_queue_items")).isTrue();
    }

    @Test
    void should_DedupeAndExcludeCurrentArt_When_ListingUpcomingArt() {
        CanonicalTrack track = TrackFixtures.withQueue(
            TrackFixtures.playing("Time", "Pink Floyd", "Dark Side", "https://img.example/dark-side.jpg"),
            List.of(
                TrackFixtures.queueItem("Money", "https://img.example/dark-side.jpg", true),
                TrackFixtures.queueItem("Dogs", "https://img.example/animals.jpg", true),
                TrackFixtures.queueItem("Pigs", "https://img.example/animals.jpg", true),
                TrackFixtures.queueItem("Unknown", null, false)));

        assertThat(track.upcomingArtUrls()).containsExactly("https://img.example/animals.jpg");
    }

    @Test
    void should_ClampAndDefault_When_DeviceReportsOddValues() {
        CanonicalTrack track = new CanonicalTrack("sonos", null, null, null, false, -5L, -1L,
            null, null, null, " ", "", TrackFixtures.OBSERVED_AT, null);

        assertThat(track.title()).isEmpty();
        assertThat(track.positionMs()).isZero();
        assertThat(track.durationMs()).isZero();
        assertThat(track.artSource()).isEqualTo(ArtSource.NONE);
        assertThat(track.originalNativeArtUrl()).isNull();
        assertThat(track.roomName()).isNull();
        assertThat(track.upcomingQueueItems()).isEmpty();
        assertThat(track.positionAuthoritative()).isFalse();
    }
}
