package com.memorygraph.shared;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

public class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal() {
        @Override public void cancel() {
            throw new UnsupportedOperationException("NONE cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal none() { return NONE; }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String operation) {
        if (cancelled.get()) {
            throw new CancellationException(operation + " cancelled");
        }
    }
}
