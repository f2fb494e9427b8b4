package dev.badgersnacks.formiddb.model;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunHandleTest {

    @Test
    void throwsOnlyAfterCancel() {
        RunHandle handle = new RunHandle();
        assertDoesNotThrow(handle::throwIfCancelled);
        handle.cancel();
        assertTrue(handle.isCancelled());
        assertThrows(CancellationException.class, handle::throwIfCancelled);
    }

    @Test
    void handlesHaveDistinctIds() {
        assertNotEquals(new RunHandle().id(), new RunHandle().id());
    }
}
