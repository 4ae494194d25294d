package net.albumart.client;

import java.time.Duration;

/**
 * Doubling reconnect delay with an upper bound. Reset once a connection delivers its
 * initial state.
 */
public class ReconnectBackoff {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    private final Duration initialDelay;
    private final Duration maxDelay;
    private Duration nextDelay;

    public ReconnectBackoff() {
        this(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
    }

    public ReconnectBackoff(Duration initialDelay, Duration maxDelay) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.nextDelay = initialDelay;
    }

    /**
     * Returns the delay to wait now and doubles the following one, up to the maximum.
     */
    public synchronized Duration nextDelay() {
        Duration current = nextDelay;
        Duration doubled = current.multipliedBy(2);
        nextDelay = doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
        return current;
    }

    public synchronized Duration peek() {
        return nextDelay;
    }

    public synchronized void reset() {
        nextDelay = initialDelay;
    }
}
