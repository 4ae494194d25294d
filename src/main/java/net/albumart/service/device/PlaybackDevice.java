package net.albumart.service.device;

import java.util.List;
import java.util.Optional;

/**
 * Query contract for a network playback device.
 */
public interface PlaybackDevice extends AutoCloseable {

    /**
     * Source name reported on every published track.
     */
    String name();

    /**
     * Whether the device is configured well enough to be polled.
     */
    boolean isAvailable();

    /**
     * Reads the current playback state.
     *
     * @return the state, or empty when the device reports no track
     * @throws DeviceQueryException when the device is unreachable or its answer cannot be parsed
     */
    Optional<DevicePlaybackInfo> queryPlayback() throws DeviceQueryException;

    /**
     * Reads the entries queued after the given position.
     *
     * @param currentPosition 1-based queue position of the current track; 0 means no queue context
     * @param limit maximum number of entries to return
     * @return upcoming entries in playback order
     * @throws DeviceQueryException when the queue cannot be read
     */
    List<DeviceQueueEntry> queryUpcomingQueue(int currentPosition, int limit) throws DeviceQueryException;

    /**
     * Releases the device connection. Never throws.
     */
    @Override
    void close();
}
