package net.albumart.service.artwork;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooldown gate for the external artwork lookup.
 *
 * <p>Closed by a rate-limit rejection for a fixed cooldown; reopens on its own once the
 * clock passes {@link #blockedUntil()}. {@link Instant#EPOCH} means not blocked.</p>
 */
@Component
public class RateLimitGate {

    private final Clock clock;
    private final AtomicReference<Instant> blockedUntil = new AtomicReference<>(Instant.EPOCH);

    public RateLimitGate(Clock clock) {
        this.clock = clock;
    }

    public boolean isBlocked() {
        Instant until = blockedUntil.get();
        if (Instant.EPOCH.equals(until)) {
            return false;
        }
        if (clock.instant().isBefore(until)) {
            return true;
        }
        blockedUntil.compareAndSet(until, Instant.EPOCH);
        return false;
    }

    /**
     * Closes the gate until now + {@code cooldown}. Never shortens an existing block.
     *
     * @return the effective instant the gate reopens
     */
    public Instant blockFor(Duration cooldown) {
        Instant candidate = clock.instant().plus(cooldown);
        return blockedUntil.accumulateAndGet(candidate, (current, proposed) -> proposed.isAfter(current) ? proposed : current);
    }

    public Instant blockedUntil() {
        return blockedUntil.get();
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), blockedUntil.get());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    void reset() {
        blockedUntil.set(Instant.EPOCH);
    }
}
