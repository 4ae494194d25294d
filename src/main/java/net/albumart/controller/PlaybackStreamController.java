/**
 * HTTP surface for display clients
 *
 * Features:
 * - GET /api/stream opens the Server-Sent Events stream (state, update, ping)
 * - GET /api/state returns the current track and when it last changed
 * - GET /api/sources reports the configured playback source and whether it can be polled
 * - GET /api/config returns the display defaults the client starts from
 */
package net.albumart.controller;

import jakarta.servlet.http.HttpServletResponse;
import net.albumart.application.realtime.PlaybackSnapshot;
import net.albumart.application.realtime.PlaybackStateBroadcaster;
import net.albumart.config.AlbumArtProperties;
import net.albumart.model.DisplayMode;
import net.albumart.model.PlaybackPayload;
import net.albumart.service.device.PlaybackDevice;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api")
public class PlaybackStreamController {

    private final PlaybackStateBroadcaster broadcaster;
    private final PlaybackDevice playbackDevice;
    private final long emitterTimeoutMillis;
    private final DisplayMode defaultMode;

    public PlaybackStreamController(PlaybackStateBroadcaster broadcaster,
                                    PlaybackDevice playbackDevice,
                                    AlbumArtProperties properties) {
        this.broadcaster = broadcaster;
        this.playbackDevice = playbackDevice;
        this.emitterTimeoutMillis = properties.getStream().getEmitterTimeout().toMillis();
        this.defaultMode = DisplayMode.fromWireValue(properties.getDisplay().getDefaultMode()).orElse(DisplayMode.ON);
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(HttpServletResponse response) {
        // Reverse proxies must not buffer the stream or keepalives never reach the client
        response.setHeader("X-Accel-Buffering", "no");
        response.setHeader("Cache-Control", "no-cache");
        SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        broadcaster.subscribe(emitter);
        return emitter;
    }

    @GetMapping(value = "/state", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PlaybackPayload> state() {
        PlaybackSnapshot snapshot = broadcaster.snapshot();
        return ResponseEntity.ok(PlaybackPayload.stateView(snapshot.track(), snapshot.lastUpdated()));
    }

    @GetMapping(value = "/sources", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PlaybackApiPayloads.SourcesResponse> sources() {
        return ResponseEntity.ok(new PlaybackApiPayloads.SourcesResponse(List.of(
            new PlaybackApiPayloads.SourceStatus(playbackDevice.name(), playbackDevice.isAvailable())
        )));
    }

    @GetMapping(value = "/config", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PlaybackApiPayloads.ConfigResponse> config() {
        return ResponseEntity.ok(new PlaybackApiPayloads.ConfigResponse(
            new PlaybackApiPayloads.DisplayConfig(defaultMode, Arrays.asList(DisplayMode.values()))
        ));
    }
}
