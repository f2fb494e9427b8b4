package dev.badgersnacks.formiddb.tools;

import dev.badgersnacks.formiddb.model.GameRelease;
import dev.badgersnacks.formiddb.store.BatchedStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormIdDatabaseCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private FormIdDatabaseCli cli;
    private Path settings;

    @BeforeEach
    void setUp() throws IOException {
        cli = new FormIdDatabaseCli(new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8), tempDir.resolve("logs"));
        settings = tempDir.resolve("settings.json");
        Files.writeString(settings, "{\"textBatchSize\": 2}");
    }

    @Test
    void missingCommandPrintsUsage() {
        assertEquals(FormIdDatabaseCli.EXIT_USAGE, cli.execute(new String[0]));
        assertTrue(err().contains("Usage:"));
    }

    @Test
    void unknownReleaseIsUsageError() {
        int exit = cli.execute(new String[]{"text", "list.txt", "Morrowind", "db.sqlite"});
        assertEquals(FormIdDatabaseCli.EXIT_USAGE, exit);
        assertTrue(err().contains("Unsupported game release: Morrowind"));
    }

    @Test
    void optionOfAnotherCommandIsRejected() {
        int exit = cli.execute(new String[]{"text", "list.txt", "SkyrimSE", "db.sqlite", "--include-base"});
        assertEquals(FormIdDatabaseCli.EXIT_USAGE, exit);
    }

    @Test
    void importsTextList() throws Exception {
        Path list = tempDir.resolve("list.txt");
        Files.write(list, List.of("A.esp|000001|One", "A.esp|000002|Two", "B.esp|000003|Three"));
        Path database = tempDir.resolve("formids.db");

        int exit = cli.execute(new String[]{"text", list.toString(), "SkyrimSE", database.toString(),
                "--update", "--settings", settings.toString()});

        assertEquals(FormIdDatabaseCli.EXIT_OK, exit, err());
        assertTrue(out().contains("Processing completed successfully: all 2 plugins succeeded."));
        BatchedStore store = new BatchedStore();
        try (Connection connection = store.open(database)) {
            assertEquals(3, store.countRows(connection, GameRelease.SKYRIM_SE));
        }
        try (var logs = Files.list(tempDir.resolve("logs"))) {
            assertEquals(1, logs.count());
        }
    }

    @Test
    void dryRunLeavesNoDatabase() {
        Path database = tempDir.resolve("formids.db");
        int exit = cli.execute(new String[]{"text", tempDir.resolve("list.txt").toString(), "Fallout4",
                database.toString(), "--dry-run", "--settings", settings.toString()});

        assertEquals(FormIdDatabaseCli.EXIT_OK, exit);
        assertTrue(out().contains("Would process FormID list file: "));
        assertFalse(Files.exists(database));
    }

    @Test
    void missingTextListFails() {
        int exit = cli.execute(new String[]{"text", tempDir.resolve("absent.txt").toString(), "SkyrimSE",
                tempDir.resolve("formids.db").toString(), "--settings", settings.toString()});
        assertEquals(FormIdDatabaseCli.EXIT_FAILURE, exit);
    }

    @Test
    void pluginRunWithoutDecoderFails() throws IOException {
        Path gameDir = tempDir.resolve("Skyrim");
        Files.createDirectories(gameDir.resolve("Data"));
        Files.writeString(gameDir.resolve("Data").resolve("Mod.esp"), "TES4");

        int exit = cli.execute(new String[]{"plugins", gameDir.toString(), "SkyrimSE",
                tempDir.resolve("formids.db").toString(), "--settings", settings.toString(), "Mod.esp"});

        assertEquals(FormIdDatabaseCli.EXIT_FAILURE, exit);
        assertTrue(err().contains("No plugin decoder is installed for SkyrimSE"));
    }

    @Test
    void pluginRunNeedsASelection() throws IOException {
        Path gameDir = tempDir.resolve("Skyrim");
        Files.createDirectories(gameDir.resolve("Data"));
        int exit = cli.execute(new String[]{"plugins", gameDir.toString(), "SkyrimSE",
                tempDir.resolve("formids.db").toString(), "--settings", settings.toString()});
        assertEquals(FormIdDatabaseCli.EXIT_USAGE, exit);
    }

    @Test
    void listPrintsCandidatePlugins() throws IOException {
        Path data = tempDir.resolve("Skyrim").resolve("Data");
        Files.createDirectories(data);
        Files.writeString(data.resolve("Skyrim.esm"), "TES4");
        Files.writeString(data.resolve("Mod.esp"), "TES4");
        Files.write(data.resolve("plugins.txt"), List.of("*Mod.esp"));

        int exit = cli.execute(new String[]{"list", data.getParent().toString(), "SkyrimSE",
                "--settings", settings.toString()});

        assertEquals(FormIdDatabaseCli.EXIT_OK, exit, err());
        assertTrue(out().lines().anyMatch("Mod.esp"::equals));
        assertFalse(out().lines().anyMatch("Skyrim.esm"::equals));
        assertTrue(out().contains("Loaded 1 non-base game plugins"));
    }

    @Test
    void cancelWithoutActiveRunReturnsImmediately() {
        cli.cancelAndAwait();
        assertTrue(err().isEmpty());
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }
}
