package dev.badgersnacks.formiddb.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionRequestTest {

    @Test
    void copiesSelectedPlugins() {
        List<String> plugins = new ArrayList<>(List.of("A.esp"));
        IngestionRequest request = IngestionRequest.forPlugins(Path.of("game"), Path.of("db.sqlite"),
                GameRelease.SKYRIM_SE, plugins, false, false);
        plugins.add("B.esp");
        assertEquals(List.of("A.esp"), request.selectedPlugins());
        assertFalse(request.isTextImport());
    }

    @Test
    void textImportIsRecognised() {
        IngestionRequest request = IngestionRequest.forTextList(Path.of("list.txt"), Path.of("db.sqlite"),
                GameRelease.FALLOUT_4, true, false);
        assertTrue(request.isTextImport());
        assertTrue(request.selectedPlugins().isEmpty());
    }

    @Test
    void requiresASource() {
        assertThrows(IllegalArgumentException.class, () -> new IngestionRequest(null, null, Path.of("db.sqlite"),
                GameRelease.SKYRIM_SE, List.of(), false, false));
    }

    @Test
    void summarisesOutcomes() {
        assertEquals("Processing completed successfully: all 3 plugins succeeded.", IngestionResult.of(3, 0).summary());
        assertEquals("Processing completed with 2 successful and 1 failed plugins.",
                IngestionResult.of(2, 1).summary());
        assertEquals(IngestionResult.Outcome.COMPLETED_WITH_FAILURES, IngestionResult.of(2, 1).outcome());
    }
}
