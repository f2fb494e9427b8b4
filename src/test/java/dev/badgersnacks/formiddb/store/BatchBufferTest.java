package dev.badgersnacks.formiddb.store;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchBufferTest {

    @Test
    void flushesInOrderWhenThresholdReached() throws SQLException {
        List<List<Integer>> flushed = new ArrayList<>();
        BatchBuffer<Integer> buffer = new BatchBuffer<>(3, flushed::add);

        assertFalse(buffer.add(1));
        assertFalse(buffer.add(2));
        assertTrue(buffer.add(3));
        buffer.add(4);
        assertEquals(1, buffer.flush());

        assertEquals(List.of(List.of(1, 2, 3), List.of(4)), flushed);
        assertTrue(buffer.isEmpty());
        assertEquals(0, buffer.flush());
    }

    @Test
    void dropsPendingRowsWhenFlushFails() {
        BatchBuffer<String> buffer = new BatchBuffer<>(10, batch -> {
            throw new SQLException("disk full");
        });
        assertThrows(SQLException.class, () -> {
            buffer.add("a");
            buffer.flush();
        });
        assertEquals(0, buffer.size());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new BatchBuffer<String>(0, batch -> {
        }));
    }
}
