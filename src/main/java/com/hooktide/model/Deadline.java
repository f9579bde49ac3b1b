package com.hooktide.model;

import java.time.Duration;

/**
 * Absolute time bound for a blocking call, bundled with the request's
 * cancellation token. Passed into the registry client so that the client itself
 * sizes its timeout and gives up, instead of a timer racing the call.
 */
public final class Deadline {

    private final long expiresAtNanos;
    private final Duration budget;
    private final CancellationToken cancellation;

    private Deadline(Duration budget, CancellationToken cancellation) {
        this.budget = budget;
        this.expiresAtNanos = System.nanoTime() + budget.toNanos();
        this.cancellation = cancellation;
    }

    public static Deadline after(Duration budget, CancellationToken cancellation) {
        if (budget == null || budget.isNegative() || budget.isZero()) {
            throw new IllegalArgumentException("Deadline budget must be positive");
        }
        return new Deadline(budget, cancellation == null ? CancellationToken.none() : cancellation);
    }

    public Duration budget() {
        return budget;
    }

    /** Time left, never negative. */
    public Duration remaining() {
        long left = expiresAtNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    public boolean isExpired() {
        return expiresAtNanos - System.nanoTime() <= 0;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }
}
