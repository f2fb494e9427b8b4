package dev.badgersnacks.formiddb.model;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cancellation token owned by exactly one run. Loops poll it cooperatively.
 */
public final class RunHandle {

    private static final AtomicLong IDS = new AtomicLong();

    private final long id = IDS.incrementAndGet();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public long id() {
        return id;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Run " + id + " was cancelled");
        }
    }
}
