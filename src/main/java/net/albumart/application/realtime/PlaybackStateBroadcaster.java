/**
 * Holds the current playback state and fans it out to stream subscribers
 *
 * Features:
 * - Read-consistent current snapshot shared by the poller, new subscribers and /api/state
 * - Joining subscribers get a "state" event before any later "update" or "ping"
 * - Best-effort delivery: a failed write drops only that subscriber
 * - Emitter completion, timeout and error callbacks unsubscribe
 */
package net.albumart.application.realtime;

import jakarta.annotation.PreDestroy;
import net.albumart.model.CanonicalTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class PlaybackStateBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(PlaybackStateBroadcaster.class);

    private final Clock clock;
    private final Executor deliveryExecutor;
    private final AtomicReference<PlaybackSnapshot> snapshot;
    private final Map<String, SubscriberConnection> subscribers = new ConcurrentHashMap<>();
    // Orders subscribe against publish/ping so "state" is always a subscriber's first event
    private final Object fanOutLock = new Object();

    @Autowired
    public PlaybackStateBroadcaster(Clock clock) {
        this(clock, newDeliveryExecutor());
    }

    PlaybackStateBroadcaster(Clock clock, Executor deliveryExecutor) {
        this.clock = clock;
        this.deliveryExecutor = deliveryExecutor;
        this.snapshot = new AtomicReference<>(PlaybackSnapshot.initial(clock.instant()));
    }

    /**
     * Registers the emitter and queues the initial {@code state} event.
     */
    public SubscriberConnection subscribe(SseEmitter emitter) {
        SubscriberConnection connection = new SubscriberConnection(emitter, deliveryExecutor, this::unsubscribe);
        emitter.onCompletion(connection::close);
        emitter.onTimeout(connection::close);
        emitter.onError(error -> {
            logger.debug("Stream subscriber {} failed: {}", connection.id(), error.getMessage());
            connection.close();
        });
        synchronized (fanOutLock) {
            subscribers.put(connection.id(), connection);
            connection.enqueue(StreamEvent.state(snapshot.get()));
        }
        logger.info("Stream subscriber {} connected ({} active)", connection.id(), subscribers.size());
        return connection;
    }

    /**
     * Replaces the current track and sends {@code update} to every subscriber.
     *
     * @param track new current track, {@code null} for "nothing playing"
     */
    public PlaybackSnapshot publish(CanonicalTrack track) {
        synchronized (fanOutLock) {
            PlaybackSnapshot published = snapshot.updateAndGet(current -> current.next(track, clock.instant()));
            StreamEvent event = StreamEvent.update(published);
            subscribers.values().forEach(connection -> connection.enqueue(event));
            logger.debug("Published version {} to {} subscriber(s)", published.version(), subscribers.size());
            return published;
        }
    }

    /**
     * Stores fresher position data for the same track without notifying anyone.
     */
    public void refreshSnapshot(CanonicalTrack track) {
        snapshot.updateAndGet(current -> current.refreshed(track));
    }

    /**
     * Sends an empty {@code ping} keepalive to every subscriber.
     */
    public void ping() {
        synchronized (fanOutLock) {
            StreamEvent event = StreamEvent.ping();
            subscribers.values().forEach(connection -> connection.enqueue(event));
        }
    }

    public void unsubscribe(SubscriberConnection connection) {
        if (subscribers.remove(connection.id()) != null) {
            connection.close();
            logger.info("Stream subscriber {} disconnected ({} active)", connection.id(), subscribers.size());
        }
    }

    public PlaybackSnapshot snapshot() {
        return snapshot.get();
    }

    public CanonicalTrack currentTrack() {
        return snapshot.get().track();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @PreDestroy
    void shutdown() {
        subscribers.values().forEach(SubscriberConnection::close);
        if (deliveryExecutor instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
    }

    private static ExecutorService newDeliveryExecutor() {
        AtomicInteger threadCounter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("stream-delivery-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
