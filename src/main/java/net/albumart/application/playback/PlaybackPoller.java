/**
 * Fixed-delay poll loop driving the playback pipeline
 *
 * Features:
 * - Queries the device, resolves artwork for the track and its upcoming queue, then diffs
 * - Publishes only significant changes; position drift refreshes the snapshot silently
 * - Tolerates a configurable number of failed polls before publishing "nothing playing"
 * - Sends heartbeat pings on their own schedule, independent of track changes
 * - Stops cleanly on shutdown and releases the device connection
 */
package net.albumart.application.playback;

import jakarta.annotation.PreDestroy;
import net.albumart.application.realtime.PlaybackStateBroadcaster;
import net.albumart.config.AlbumArtProperties;
import net.albumart.model.CanonicalTrack;
import net.albumart.model.QueueItem;
import net.albumart.service.device.DevicePlaybackInfo;
import net.albumart.service.device.DeviceQueryException;
import net.albumart.service.device.DeviceQueueEntry;
import net.albumart.service.device.PlaybackDevice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
public class PlaybackPoller {

    private static final Logger logger = LoggerFactory.getLogger(PlaybackPoller.class);

    private final PlaybackDevice device;
    private final TrackNormalizer trackNormalizer;
    private final QueuePrefetchEnricher queueEnricher;
    private final PlaybackStateBroadcaster broadcaster;
    private final TaskScheduler taskScheduler;
    private final PlaybackStateTracker stateTracker;
    private final int graceCycles;
    private final boolean enabled;
    private final Duration pollInterval;
    private final Duration heartbeatInterval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile ScheduledFuture<?> pollTask;
    private volatile ScheduledFuture<?> heartbeatTask;

    public PlaybackPoller(PlaybackDevice device,
                          TrackNormalizer trackNormalizer,
                          QueuePrefetchEnricher queueEnricher,
                          PlaybackStateBroadcaster broadcaster,
                          TaskScheduler taskScheduler,
                          AlbumArtProperties properties) {
        this.device = device;
        this.trackNormalizer = trackNormalizer;
        this.queueEnricher = queueEnricher;
        this.broadcaster = broadcaster;
        this.taskScheduler = taskScheduler;
        this.graceCycles = properties.getPolling().getGraceCycles();
        this.stateTracker = new PlaybackStateTracker(graceCycles);
        this.enabled = properties.getPolling().isEnabled();
        this.pollInterval = properties.getPolling().getInterval();
        this.heartbeatInterval = properties.getStream().getHeartbeatInterval();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            logger.info("Playback polling disabled (album-art.polling.enabled=false)");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        if (!device.isAvailable()) {
            logger.warn("Playback device '{}' is not configured; every poll will report nothing playing", device.name());
        }
        pollTask = taskScheduler.scheduleWithFixedDelay(this::pollOnce, pollInterval);
        heartbeatTask = taskScheduler.scheduleAtFixedRate(broadcaster::ping, heartbeatInterval);
        logger.info("Playback polling started for '{}' every {} (heartbeat every {})",
            device.name(), pollInterval, heartbeatInterval);
    }

    /**
     * Runs one poll cycle. Never throws, so the fixed-delay schedule keeps going.
     */
    public void pollOnce() {
        if (stopped.get()) {
            return;
        }
        CanonicalTrack track = null;
        try {
            track = readCurrentTrack();
        } catch (DeviceQueryException e) {
            logger.warn("Device poll failed for '{}': {}", device.name(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error during poll cycle for '{}'", device.name(), e);
        }
        apply(track);
    }

    private CanonicalTrack readCurrentTrack() throws DeviceQueryException {
        Optional<DevicePlaybackInfo> playback = device.queryPlayback();
        if (playback.isEmpty() || !playback.get().hasTrack()) {
            return null;
        }
        DevicePlaybackInfo info = playback.get();
        List<QueueItem> upcoming = queueEnricher.enrich(readUpcomingQueue(info));
        return trackNormalizer.normalize(device.name(), info, upcoming);
    }

    private List<DeviceQueueEntry> readUpcomingQueue(DevicePlaybackInfo info) {
        if (queueEnricher.lookahead() == 0) {
            return List.of();
        }
        try {
            return device.queryUpcomingQueue(info.queuePosition(), queueEnricher.lookahead());
        } catch (DeviceQueryException e) {
            // Queue data is decoration; the current track still publishes
            logger.debug("Queue read failed for '{}': {}", device.name(), e.getMessage());
            return List.of();
        }
    }

    private void apply(CanonicalTrack track) {
        PlaybackStateTracker.Decision decision = stateTracker.offer(track);
        switch (decision) {
            case PUBLISH -> {
                broadcaster.publish(track);
                if (track == null) {
                    logger.info("Nothing playing on '{}'", device.name());
                } else {
                    logger.info("Now {}: '{}' by '{}' ({} art, {})", track.isPlaying() ? "playing" : "paused",
                        track.title(), track.artist(), track.artSource().wireValue(), track.artSourceReason());
                }
            }
            case REFRESH -> broadcaster.refreshSnapshot(track);
            case HOLD -> logger.debug("No report from '{}' ({} of {} grace cycles)",
                device.name(), stateTracker.consecutiveMisses(), graceCycles);
            case UNCHANGED -> {
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void stop() {
        stopped.set(true);
        running.set(false);
        cancel(pollTask);
        cancel(heartbeatTask);
        device.close();
        logger.info("Playback polling stopped");
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }
}
