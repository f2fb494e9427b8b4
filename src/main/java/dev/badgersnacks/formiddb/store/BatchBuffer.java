package dev.badgersnacks.formiddb.store;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered buffer of pending rows that hands itself to a {@link Flusher} once it reaches its
 * threshold. Pending rows are dropped after a flush attempt whether or not it succeeded.
 */
public final class BatchBuffer<T> {

    @FunctionalInterface
    public interface Flusher<T> {
        void flush(List<T> batch) throws SQLException;
    }

    private final int threshold;
    private final Flusher<T> flusher;
    private final List<T> pending;

    public BatchBuffer(int threshold, Flusher<T> flusher) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        this.threshold = threshold;
        this.flusher = Objects.requireNonNull(flusher, "flusher");
        this.pending = new ArrayList<>(threshold);
    }

    /**
     * @return {@code true} when this add triggered a flush
     */
    public boolean add(T item) throws SQLException {
        pending.add(Objects.requireNonNull(item, "item"));
        if (pending.size() >= threshold) {
            flush();
            return true;
        }
        return false;
    }

    /**
     * @return number of rows handed to the flusher
     */
    public int flush() throws SQLException {
        if (pending.isEmpty()) {
            return 0;
        }
        List<T> batch = List.copyOf(pending);
        pending.clear();
        flusher.flush(batch);
        return batch.size();
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
