package com.bank.mulegraph.engine;

import com.bank.mulegraph.exception.BatchCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a batch run and whoever may stop it.
 * Algorithms check it between passes and levels, never mid-sweep.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String stage) {
        if (cancelled.get()) {
            throw new BatchCancelledException("Batch cancelled during " + stage);
        }
    }
}
