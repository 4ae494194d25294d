package net.albumart.client;

/**
 * Lifecycle of a {@link PlaybackStreamClient} connection.
 */
public enum ConnectionState {
    /** No open stream; a reconnect may be pending. */
    DISCONNECTED,
    /** Request sent, initial state not yet received. */
    CONNECTING,
    /** Initial state received; updates flow. */
    CONNECTED
}
