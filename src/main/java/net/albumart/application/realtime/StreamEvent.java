package net.albumart.application.realtime;

import net.albumart.model.PlaybackPayload;

import java.util.Map;

/**
 * One named event queued for a subscriber.
 *
 * @param name SSE event name
 * @param data JSON payload
 * @param version snapshot version for {@code state}/{@code update}, {@code -1} for unversioned events
 */
record StreamEvent(String name, Object data, long version) {

    static final String STATE = "state";
    static final String UPDATE = "update";
    static final String PING = "ping";

    static StreamEvent state(PlaybackSnapshot snapshot) {
        return new StreamEvent(STATE, PlaybackPayload.streamEvent(snapshot.track()), snapshot.version());
    }

    static StreamEvent update(PlaybackSnapshot snapshot) {
        return new StreamEvent(UPDATE, PlaybackPayload.streamEvent(snapshot.track()), snapshot.version());
    }

    static StreamEvent ping() {
        return new StreamEvent(PING, Map.of(), -1L);
    }

    boolean isVersioned() {
        return version >= 0;
    }
}
