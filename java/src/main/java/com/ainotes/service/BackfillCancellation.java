package com.ainotes.service;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-scoped cancellation signal for a backfill run.
 *
 * Cancelling stops the run before the next note and abandons the AI call in
 * flight; progress made so far is still committed.
 */
public class BackfillCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.One<Boolean> signal = Sinks.one();

    public static BackfillCancellation none() {
        return new BackfillCancellation();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitValue(Boolean.TRUE);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Emits once when {@link #cancel()} is called; replays to late subscribers.
     */
    public Mono<Boolean> asMono() {
        return signal.asMono();
    }
}
