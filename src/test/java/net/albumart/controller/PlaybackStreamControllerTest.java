package net.albumart.controller;

import net.albumart.application.realtime.PlaybackSnapshot;
import net.albumart.application.realtime.PlaybackStateBroadcaster;
import net.albumart.config.AlbumArtProperties;
import net.albumart.model.CanonicalTrack;
import net.albumart.model.DisplayMode;
import net.albumart.model.PlaybackPayload;
import net.albumart.service.device.PlaybackDevice;
import net.albumart.testutil.TrackFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlaybackStreamControllerTest {

    private final JsonMapper jsonMapper = JsonMapper.builder().build();

    @Mock
    private PlaybackStateBroadcaster broadcaster;

    @Mock
    private PlaybackDevice playbackDevice;

    private AlbumArtProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AlbumArtProperties();
        properties.getStream().setEmitterTimeout(Duration.ofMinutes(30));
    }

    private PlaybackStreamController controller() {
        return new PlaybackStreamController(broadcaster, playbackDevice, properties);
    }

    @Test
    void should_SubscribeEmitterAndDisableBuffering_When_StreamOpened() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        SseEmitter emitter = controller().stream(response);

        verify(broadcaster).subscribe(emitter);
        assertThat(emitter.getTimeout()).isEqualTo(Duration.ofMinutes(30).toMillis());
        assertThat(response.getHeader("X-Accel-Buffering")).isEqualTo("no");
        assertThat(response.getHeader("Cache-Control")).isEqualTo("no-cache");
    }

    @Test
    void should_ReturnCurrentTrackAndLastUpdated_When_StateRequested() {
        CanonicalTrack track = TrackFixtures.playing("Mother", "Pink Floyd", "The Wall", "https://img.example/wall.jpg");
        Instant changedAt = Instant.parse("2026-03-01T12:00:05Z");
        when(broadcaster.snapshot()).thenReturn(new PlaybackSnapshot(3L, track, changedAt));

        ResponseEntity<PlaybackPayload> response = controller().state();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo(PlaybackPayload.stateView(track, changedAt));
    }

    @Test
    void should_SerializeExplicitNullTrack_When_NothingPlaying() {
        Instant changedAt = Instant.parse("2026-03-01T12:00:05Z");
        when(broadcaster.snapshot()).thenReturn(new PlaybackSnapshot(0L, null, changedAt));

        JsonNode body = jsonMapper.valueToTree(controller().state().getBody());

        assertThat(body.has("current_track")).isTrue();
        assertThat(body.get("current_track").isNull()).isTrue();
        assertThat(body.has("last_updated")).isTrue();
    }

    @Test
    void should_ReportSourceAvailability_When_SourcesRequested() {
        when(playbackDevice.name()).thenReturn("sonos");
        when(playbackDevice.isAvailable()).thenReturn(false);

        JsonNode body = jsonMapper.valueToTree(controller().sources().getBody());

        assertThat(body.get("sources").size()).isEqualTo(1);
        assertThat(body.get("sources").get(0).get("name").asString()).isEqualTo("sonos");
        assertThat(body.get("sources").get(0).get("available").asBoolean()).isFalse();
    }

    @Test
    void should_ExposeConfiguredDefaultMode_When_ConfigRequested() {
        properties.getDisplay().setDefaultMode("Detailed");

        JsonNode body = jsonMapper.valueToTree(controller().config().getBody());

        assertThat(body.get("display").get("default_mode").asString()).isEqualTo("detailed");
        assertThat(body.get("display").get("available_modes").size()).isEqualTo(DisplayMode.values().length);
        assertThat(body.get("display").get("available_modes").get(0).asString()).isEqualTo("on");
    }
}
