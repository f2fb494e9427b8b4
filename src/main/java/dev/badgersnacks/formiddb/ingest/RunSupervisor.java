package dev.badgersnacks.formiddb.ingest;

import dev.badgersnacks.formiddb.model.RunHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Owns the single active {@link RunHandle}. Starting a run cancels whichever run held the slot.
 */
public final class RunSupervisor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunSupervisor.class);

    private final Object lock = new Object();
    private RunHandle current;

    public RunHandle begin() {
        RunHandle next = new RunHandle();
        RunHandle previous;
        synchronized (lock) {
            previous = current;
            current = next;
        }
        if (previous != null) {
            LOGGER.info("Run {} replaced by run {}; cancelling it", previous.id(), next.id());
            previous.cancel();
        }
        return next;
    }

    /**
     * Clears the slot only if {@code handle} still owns it; a replaced run must not evict its successor.
     */
    public boolean release(RunHandle handle) {
        synchronized (lock) {
            if (current == handle) {
                current = null;
                return true;
            }
            return false;
        }
    }

    public boolean cancelCurrent() {
        RunHandle active;
        synchronized (lock) {
            active = current;
        }
        if (active == null) {
            return false;
        }
        active.cancel();
        return true;
    }

    public Optional<RunHandle> current() {
        synchronized (lock) {
            return Optional.ofNullable(current);
        }
    }
}
