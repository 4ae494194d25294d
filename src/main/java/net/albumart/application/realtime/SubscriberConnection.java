package net.albumart.application.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One open push channel to a display client.
 *
 * <p>Events are queued and written by at most one drain task at a time, so a subscriber
 * sees them in enqueue order and a slow client only delays itself. Versioned events that
 * are not newer than the last one written are dropped.</p>
 */
public class SubscriberConnection {

    private static final Logger log = LoggerFactory.getLogger(SubscriberConnection.class);

    private final String id;
    private final SseEmitter emitter;
    private final Executor executor;
    private final Consumer<SubscriberConnection> onClosed;
    private final Queue<StreamEvent> outbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Written only by the active drain task
    private volatile long lastSentVersion = -1L;

    SubscriberConnection(SseEmitter emitter, Executor executor, Consumer<SubscriberConnection> onClosed) {
        this.id = UUID.randomUUID().toString();
        this.emitter = emitter;
        this.executor = executor;
        this.onClosed = onClosed;
    }

    public String id() {
        return id;
    }

    public long lastSentVersion() {
        return lastSentVersion;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    void enqueue(StreamEvent event) {
        if (closed.get()) {
            return;
        }
        outbox.add(event);
        scheduleDrain();
    }

    /**
     * Stops delivery and drops pending events. Idempotent.
     */
    void close() {
        if (closed.compareAndSet(false, true)) {
            outbox.clear();
            onClosed.accept(this);
        }
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException rejected) {
            draining.set(false);
            log.warn("Stream executor rejected delivery for subscriber {}; closing it", id);
            close();
        }
    }

    private void drain() {
        try {
            StreamEvent event;
            while (!closed.get() && (event = outbox.poll()) != null) {
                deliver(event);
            }
        } finally {
            draining.set(false);
        }
        // An enqueue may have lost the race with the finally block above
        if (!closed.get() && !outbox.isEmpty()) {
            scheduleDrain();
        }
    }

    private void deliver(StreamEvent event) {
        if (event.isVersioned() && event.version() <= lastSentVersion) {
            return;
        }
        try {
            synchronized (emitter) {
                emitter.send(SseEmitter.event().name(event.name()).data(event.data()));
            }
            if (event.isVersioned()) {
                lastSentVersion = event.version();
            }
        } catch (IOException | IllegalStateException deliveryException) {
            log.debug("Dropping subscriber {} after failed '{}' delivery: {}", id, event.name(), deliveryException.getMessage());
            close();
            safelyComplete();
        }
    }

    private void safelyComplete() {
        try {
            emitter.complete();
        } catch (IllegalStateException completionException) {
            log.debug("SSE emitter completion failed for subscriber {} (response likely already committed): {}",
                id, completionException.getMessage());
        }
    }
}
