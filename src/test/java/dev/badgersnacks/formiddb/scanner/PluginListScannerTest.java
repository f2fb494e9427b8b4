package dev.badgersnacks.formiddb.scanner;

import dev.badgersnacks.formiddb.agents.AgentOrchestrator;
import dev.badgersnacks.formiddb.ingest.RecordingErrorSink;
import dev.badgersnacks.formiddb.loadorder.FixedLoadOrderProvider;
import dev.badgersnacks.formiddb.loadorder.LoadOrderProvider;
import dev.badgersnacks.formiddb.loadorder.LoadOrderResolver;
import dev.badgersnacks.formiddb.model.GameRelease;
import dev.badgersnacks.formiddb.model.MasterStyle;
import dev.badgersnacks.formiddb.model.PluginListItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginListScannerTest {

    private static final GameRelease RELEASE = GameRelease.SKYRIM_SE;

    @TempDir
    Path gameDir;

    private final RecordingErrorSink errors = new RecordingErrorSink();
    private AgentOrchestrator agents;

    @BeforeEach
    void setUp() throws IOException {
        agents = new AgentOrchestrator(2);
        Files.createDirectories(gameDir.resolve("Data"));
    }

    @AfterEach
    void tearDown() {
        agents.close();
    }

    @Test
    void publishesInstalledNonBasePluginsOnce() throws IOException {
        install("Skyrim.esm", "Update.esm", "ModA.esp", "ModB.esp");
        PluginListScanner scanner = scanner(FixedLoadOrderProvider.of(
                "Skyrim.esm", "Update.esm", "ModA.esp", "moda.esp", "Missing.esp", "ModB.esp"));
        PluginCandidateList target = new PluginCandidateList();

        ScanResult result = scanner.refreshList(gameDir, RELEASE, target, false).join();

        assertEquals(ScanResult.Status.PUBLISHED, result.status());
        assertEquals(List.of("ModA.esp", "ModB.esp"), names(target));
        assertEquals(List.of("Loaded 2 non-base game plugins"), errors.notices());
        assertTrue(errors.warnings().isEmpty());
    }

    @Test
    void includesBasePluginsOnRequest() throws IOException {
        install("Skyrim.esm", "ModA.esp");
        PluginListScanner scanner = scanner(FixedLoadOrderProvider.of("Skyrim.esm", "ModA.esp"));
        PluginCandidateList target = new PluginCandidateList();

        scanner.refreshList(gameDir.resolve("Data"), RELEASE, target, true).join();

        assertEquals(List.of("Skyrim.esm", "ModA.esp"), names(target));
        assertEquals(List.of("Loaded 2 plugins"), errors.notices());
    }

    @Test
    void staleScanIsDiscardedWhole() throws Exception {
        install("Old.esp", "New.esp");
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        LoadOrderProvider provider = new LoadOrderProvider() {
            @Override
            public List<String> listings(GameRelease release, Path dataPath) throws IOException {
                if (calls.incrementAndGet() == 1) {
                    firstStarted.countDown();
                    try {
                        releaseFirst.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IOException(e);
                    }
                    return List.of("Old.esp");
                }
                return List.of("New.esp");
            }

            @Override
            public MasterStyle masterStyle(Path pluginPath, GameRelease release) {
                return MasterStyle.FULL;
            }
        };
        PluginListScanner scanner = scanner(provider);
        PluginCandidateList target = new PluginCandidateList();

        CompletableFuture<ScanResult> first = scanner.refreshList(gameDir, RELEASE, target, false);
        assertTrue(firstStarted.await(10, TimeUnit.SECONDS));
        ScanResult second = scanner.refreshList(gameDir, RELEASE, target, false).join();
        releaseFirst.countDown();

        assertEquals(ScanResult.Status.PUBLISHED, second.status());
        assertEquals(ScanResult.Status.SUPERSEDED, first.join().status());
        assertEquals(List.of("New.esp"), names(target));
        assertEquals(2, scanner.currentGeneration());
    }

    @Test
    void failureClearsTargetAndExplains() {
        PluginCandidateList target = new PluginCandidateList();
        target.replaceAll(List.of(new PluginListItem("Previous.esp")));
        PluginListScanner scanner = scanner(FixedLoadOrderProvider.failing("Access denied"));

        ScanResult result = scanner.refreshList(gameDir, RELEASE, target, false).join();

        assertEquals(ScanResult.Status.FAILED, result.status());
        assertTrue(target.isEmpty());
        assertEquals(List.of("Failed to load plugins: Access denied"), errors.warnings());
        assertEquals(List.of("Ensure you selected the correct game Data directory"), errors.notices());
    }

    @Test
    void reportsProgressEveryIntervalConfirmedPlugins() throws IOException {
        install("A.esp", "B.esp", "C.esp", "D.esp", "E.esp");
        List<String> progress = Collections.synchronizedList(new ArrayList<>());
        PluginListScanner scanner = new PluginListScanner(
                new LoadOrderResolver(FixedLoadOrderProvider.of("A.esp", "B.esp", "C.esp", "D.esp", "E.esp")),
                agents, Runnable::run, errors, (message, percent) -> progress.add(message), 2);

        scanner.refreshList(gameDir, RELEASE, new PluginCandidateList(), false).join();

        assertEquals(List.of("Found 2 plugins...", "Found 4 plugins..."), progress);
    }

    @Test
    void selectAllAndSelectNoneToggleEveryCandidate() {
        PluginCandidateList target = new PluginCandidateList();
        target.replaceAll(List.of(new PluginListItem("A.esp"), new PluginListItem("B.esp", true)));

        PluginListScanner.selectAll(target);
        assertEquals(List.of("A.esp", "B.esp"), target.selectedNames());

        PluginListScanner.selectNone(target);
        assertTrue(target.selectedNames().isEmpty());
        assertFalse(target.snapshot().get(1).selected());
    }

    private PluginListScanner scanner(LoadOrderProvider provider) {
        return new PluginListScanner(new LoadOrderResolver(provider), agents, errors);
    }

    private void install(String... names) throws IOException {
        for (String name : names) {
            Files.writeString(gameDir.resolve("Data").resolve(name), "TES4");
        }
    }

    private static List<String> names(PluginCandidateList target) {
        return target.snapshot().stream().map(PluginListItem::name).toList();
    }
}
