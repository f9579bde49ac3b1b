package com.hooktide.model;

import com.hooktide.exception.ChainCancelledException;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Flipped once when the caller stops waiting for a chain run (client disconnect,
 * request timeout). Stages check it at their boundaries; it is never reset.
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel(String why) {
        reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled(Stage stage) {
        String why = reason.get();
        if (why != null) {
            throw new ChainCancelledException(stage, why);
        }
    }
}
