package dev.badgersnacks.formiddb.scanner;

import dev.badgersnacks.formiddb.agents.AgentOrchestrator;
import dev.badgersnacks.formiddb.agents.AgentTask;
import dev.badgersnacks.formiddb.ingest.ErrorSink;
import dev.badgersnacks.formiddb.ingest.ProgressListener;
import dev.badgersnacks.formiddb.loadorder.LoadOrderResolver;
import dev.badgersnacks.formiddb.model.GameRelease;
import dev.badgersnacks.formiddb.model.PluginListItem;
import dev.badgersnacks.formiddb.util.DataPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds the list of plugins a user can pick from.
 *
 * <p>Every call takes a new generation number. Probing runs on the agent pool; when it finishes the
 * result is published on the publish executor only if no newer scan has started in the meantime.
 * A stale result is dropped whole.
 */
public class PluginListScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginListScanner.class);
    public static final int DEFAULT_PROGRESS_INTERVAL = 10;

    private final LoadOrderResolver loadOrderResolver;
    private final AgentOrchestrator agents;
    private final Executor publishExecutor;
    private final ErrorSink errors;
    private final ProgressListener progress;
    private final int progressInterval;
    private final AtomicLong generation = new AtomicLong();

    public PluginListScanner(LoadOrderResolver loadOrderResolver, AgentOrchestrator agents, ErrorSink errors) {
        this(loadOrderResolver, agents, Runnable::run, errors, ProgressListener.NONE, DEFAULT_PROGRESS_INTERVAL);
    }

    public PluginListScanner(LoadOrderResolver loadOrderResolver,
                             AgentOrchestrator agents,
                             Executor publishExecutor,
                             ErrorSink errors,
                             ProgressListener progress,
                             int progressInterval) {
        this.loadOrderResolver = Objects.requireNonNull(loadOrderResolver, "loadOrderResolver");
        this.agents = Objects.requireNonNull(agents, "agents");
        this.publishExecutor = Objects.requireNonNull(publishExecutor, "publishExecutor");
        this.errors = Objects.requireNonNull(errors, "errors");
        this.progress = progress == null ? ProgressListener.NONE : progress;
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be positive: " + progressInterval);
        }
        this.progressInterval = progressInterval;
    }

    public CompletableFuture<ScanResult> refreshList(Path gameDirectory,
                                                     GameRelease release,
                                                     PluginCandidateList target,
                                                     boolean includeBasePlugins) {
        Objects.requireNonNull(gameDirectory, "gameDirectory");
        Objects.requireNonNull(release, "release");
        Objects.requireNonNull(target, "target");
        long scanGeneration = generation.incrementAndGet();
        PluginScanAgentTask task = new PluginScanAgentTask(gameDirectory, release, includeBasePlugins);

        return agents.submit(task)
                .handleAsync((result, error) -> {
                    if (isStale(scanGeneration)) {
                        LOGGER.debug("Discarding scan {}; scan {} is newer", scanGeneration, generation.get());
                        return ScanResult.superseded(scanGeneration);
                    }
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        LOGGER.warn("Plugin scan {} failed for {}", scanGeneration, gameDirectory, cause);
                        target.clear();
                        errors.warn("Failed to load plugins: " + describe(cause));
                        errors.info("Ensure you selected the correct game Data directory");
                        return ScanResult.failed(scanGeneration);
                    }
                    List<String> names = result.payload();
                    target.replaceAll(names.stream().map(PluginListItem::new).toList());
                    errors.info(includeBasePlugins
                            ? "Loaded " + names.size() + " plugins"
                            : "Loaded " + names.size() + " non-base game plugins");
                    return ScanResult.published(scanGeneration, names);
                }, publishExecutor);
    }

    public long currentGeneration() {
        return generation.get();
    }

    public static void selectAll(PluginCandidateList target) {
        target.snapshot().forEach(item -> item.setSelected(true));
    }

    public static void selectNone(PluginCandidateList target) {
        target.snapshot().forEach(item -> item.setSelected(false));
    }

    private boolean isStale(long scanGeneration) {
        return scanGeneration != generation.get();
    }

    List<String> listInstalledPlugins(Path gameDirectory, GameRelease release, boolean includeBasePlugins) throws Exception {
        Path dataPath = DataPaths.resolveDataPath(gameDirectory);
        List<String> listed = loadOrderResolver.listedPluginNames(release, dataPath);
        Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        List<String> confirmed = new ArrayList<>();
        for (String name : listed) {
            if (!includeBasePlugins && release.isBasePlugin(name)) {
                continue;
            }
            if (!Files.isRegularFile(dataPath.resolve(name)) || !seen.add(name)) {
                continue;
            }
            confirmed.add(name);
            if (confirmed.size() % progressInterval == 0) {
                progress.onProgress("Found " + confirmed.size() + " plugins...", null);
            }
        }
        LOGGER.debug("Scan of {} confirmed {} of {} listed plugins", dataPath, confirmed.size(), listed.size());
        return confirmed;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private final class PluginScanAgentTask implements AgentTask<List<String>> {
        private final Path gameDirectory;
        private final GameRelease release;
        private final boolean includeBasePlugins;

        private PluginScanAgentTask(Path gameDirectory, GameRelease release, boolean includeBasePlugins) {
            this.gameDirectory = gameDirectory;
            this.release = release;
            this.includeBasePlugins = includeBasePlugins;
        }

        @Override
        public String name() {
            return "plugin-scan";
        }

        @Override
        public List<String> run() throws Exception {
            return listInstalledPlugins(gameDirectory, release, includeBasePlugins);
        }
    }
}
