/**
 * Subscriber side of the playback stream, for display processes written in Java
 *
 * Features:
 * - Consumes /api/stream as Server-Sent Events through the reactive WebClient
 * - Hands every "state" and "update" track to the listener; {@code null} means nothing playing
 * - Explicit DISCONNECTED / CONNECTING / CONNECTED state machine
 * - Exactly one pending reconnect at a time, with doubling backoff reset by the next "state"
 * - Own connector without a read timeout; silence longer than the idle timeout (three missed
 *   heartbeats by default) drops the stream and reconnects
 */
package net.albumart.client;

import net.albumart.model.CanonicalTrack;
import net.albumart.model.PlaybackPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import io.netty.channel.ChannelOption;
import reactor.core.Disposable;
import reactor.netty.http.client.HttpClient;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

public class PlaybackStreamClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PlaybackStreamClient.class);
    private static final String STREAM_PATH = "/api/stream";
    private static final int CONNECT_TIMEOUT_MILLIS = 5000;

    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(45);
    private static final ParameterizedTypeReference<ServerSentEvent<String>> EVENT_TYPE =
        new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final ScheduledExecutorService scheduler;
    private final ReconnectBackoff backoff;
    private final ObjectMapper objectMapper;
    private final Consumer<CanonicalTrack> listener;
    private final Duration idleTimeout;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);

    // Guarded by this
    private Disposable subscription;
    private ScheduledFuture<?> pendingReconnect;
    private boolean closed;

    public PlaybackStreamClient(WebClient.Builder webClientBuilder,
                                String baseUrl,
                                ScheduledExecutorService scheduler,
                                ReconnectBackoff backoff,
                                Consumer<CanonicalTrack> listener) {
        this(webClientBuilder, baseUrl, scheduler, backoff, defaultObjectMapper(), listener);
    }

    public PlaybackStreamClient(WebClient.Builder webClientBuilder,
                                String baseUrl,
                                ScheduledExecutorService scheduler,
                                ReconnectBackoff backoff,
                                ObjectMapper objectMapper,
                                Consumer<CanonicalTrack> listener) {
        this(webClientBuilder, baseUrl, scheduler, backoff, objectMapper, listener, DEFAULT_IDLE_TIMEOUT);
    }

    PlaybackStreamClient(WebClient.Builder webClientBuilder,
                         String baseUrl,
                         ScheduledExecutorService scheduler,
                         ReconnectBackoff backoff,
                         ObjectMapper objectMapper,
                         Consumer<CanonicalTrack> listener,
                         Duration idleTimeout) {
        // Keepalives arrive only every heartbeat interval, so a shared builder's read timeout must not apply
        HttpClient streamingClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);
        this.webClient = webClientBuilder.clone()
            .clientConnector(new ReactorClientHttpConnector(streamingClient))
            .baseUrl(baseUrl)
            .build();
        this.scheduler = scheduler;
        this.backoff = backoff;
        this.objectMapper = objectMapper;
        this.listener = listener;
        this.idleTimeout = idleTimeout;
    }

    /**
     * Opens the stream. Any open stream or pending reconnect is replaced.
     */
    public void connect() {
        Disposable previous;
        synchronized (this) {
            if (closed) {
                return;
            }
            cancelPendingReconnect();
            previous = subscription;
            subscription = null;
            state.set(ConnectionState.CONNECTING);
        }
        if (previous != null) {
            previous.dispose();
        }

        logger.debug("Connecting to playback stream");
        Disposable opened = webClient.get()
            .uri(STREAM_PATH)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .retrieve()
            .bodyToFlux(EVENT_TYPE)
            .timeout(idleTimeout)
            .subscribe(this::onEvent, this::onStreamError, this::onStreamComplete);

        synchronized (this) {
            if (closed) {
                opened.dispose();
            } else if (subscription == null && state.get() != ConnectionState.DISCONNECTED) {
                subscription = opened;
            }
        }
    }

    public ConnectionState state() {
        return state.get();
    }

    public synchronized boolean hasPendingReconnect() {
        return pendingReconnect != null && !pendingReconnect.isDone();
    }

    @Override
    public void close() {
        Disposable open;
        synchronized (this) {
            closed = true;
            cancelPendingReconnect();
            open = subscription;
            subscription = null;
            state.set(ConnectionState.DISCONNECTED);
        }
        if (open != null) {
            open.dispose();
        }
    }

    void onEvent(ServerSentEvent<String> event) {
        String name = event.event();
        if (name == null) {
            return;
        }
        switch (name) {
            case "state" -> {
                state.set(ConnectionState.CONNECTED);
                backoff.reset();
                deliver(name, event.data());
            }
            case "update" -> deliver(name, event.data());
            case "ping" -> logger.trace("Playback stream keepalive");
            default -> logger.debug("Ignoring unknown stream event '{}'", name);
        }
    }

    private void deliver(String eventName, String data) {
        if (!StringUtils.hasText(data)) {
            logger.warn("Playback stream '{}' event without data", eventName);
            return;
        }
        PlaybackPayload payload;
        try {
            payload = objectMapper.readValue(data, PlaybackPayload.class);
        } catch (JacksonException e) {
            logger.warn("Malformed playback stream '{}' payload: {}", eventName, e.getOriginalMessage());
            return;
        }
        try {
            listener.accept(payload.currentTrack());
        } catch (RuntimeException e) {
            logger.error("Playback listener failed on '{}' event", eventName, e);
        }
    }

    private void onStreamError(Throwable error) {
        logger.warn("Playback stream failed: {}", error.toString());
        scheduleReconnect();
    }

    private void onStreamComplete() {
        logger.info("Playback stream closed by server");
        scheduleReconnect();
    }

    private synchronized void scheduleReconnect() {
        subscription = null;
        state.set(ConnectionState.DISCONNECTED);
        if (closed || hasPendingReconnect()) {
            return;
        }
        Duration delay = backoff.nextDelay();
        logger.info("Reconnecting to playback stream in {} ms", delay.toMillis());
        pendingReconnect = scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    private static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}
