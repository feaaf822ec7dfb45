package dev.changeguard.domain.valueobject;

import java.time.Duration;

/**
 * Cooperative cancellation signal for one processing attempt. Every external call
 * is bounded by the smaller of its own budget and the time left here.
 */
public final class Deadline {

    private final long expiresAtNanos;

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration budget) {
        return new Deadline(System.nanoTime() + budget.toNanos());
    }

    public Duration remaining() {
        long left = expiresAtNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    public boolean isExpired() {
        return remaining().isZero();
    }

    public Duration cap(Duration budget) {
        Duration left = remaining();
        return budget.compareTo(left) <= 0 ? budget : left;
    }
}
