package dev.badgersnacks.formiddb.ingest;

import dev.badgersnacks.formiddb.agents.AgentOrchestrator;
import dev.badgersnacks.formiddb.agents.AgentResult;
import dev.badgersnacks.formiddb.agents.AgentTask;
import dev.badgersnacks.formiddb.loadorder.LoadOrderResolver;
import dev.badgersnacks.formiddb.loadorder.LoadOrderSnapshot;
import dev.badgersnacks.formiddb.model.IngestionRequest;
import dev.badgersnacks.formiddb.model.IngestionResult;
import dev.badgersnacks.formiddb.model.RunHandle;
import dev.badgersnacks.formiddb.store.BatchedStore;
import dev.badgersnacks.formiddb.util.DataPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Sequences one ingestion run: schema setup, then either a text list import or a plugin-by-plugin
 * extraction, then compaction.
 *
 * <p>Only one run is active at a time. A plugin that fails is counted and skipped; cancellation and
 * setup failures end the run.
 */
public class IngestionOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionOrchestrator.class);

    private final BatchedStore store;
    private final LoadOrderResolver loadOrderResolver;
    private final RecordExtractor recordExtractor;
    private final TextListExtractor textListExtractor;
    private final ErrorSink errors;
    private final AgentOrchestrator agents;
    private final RunSupervisor supervisor;

    public IngestionOrchestrator(BatchedStore store,
                                 LoadOrderResolver loadOrderResolver,
                                 RecordExtractor recordExtractor,
                                 TextListExtractor textListExtractor,
                                 ErrorSink errors,
                                 AgentOrchestrator agents,
                                 RunSupervisor supervisor) {
        this.store = Objects.requireNonNull(store, "store");
        this.loadOrderResolver = Objects.requireNonNull(loadOrderResolver, "loadOrderResolver");
        this.recordExtractor = Objects.requireNonNull(recordExtractor, "recordExtractor");
        this.textListExtractor = Objects.requireNonNull(textListExtractor, "textListExtractor");
        this.errors = Objects.requireNonNull(errors, "errors");
        this.agents = Objects.requireNonNull(agents, "agents");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    }

    /**
     * Runs {@link #run} on the agent pool.
     */
    public CompletableFuture<AgentResult<IngestionResult>> submit(IngestionRequest request, ProgressListener progress) {
        Objects.requireNonNull(request, "request");
        return agents.submit(new IngestionAgentTask(request, progress));
    }

    /**
     * @throws CancellationException when this run is cancelled or replaced by a newer one
     */
    public IngestionResult run(IngestionRequest request, ProgressListener progress) throws Exception {
        Objects.requireNonNull(request, "request");
        ProgressListener listener = progress == null ? ProgressListener.NONE : progress;
        RunHandle handle = supervisor.begin();
        try {
            if (request.dryRun()) {
                return describeDryRun(request, listener);
            }
            return execute(request, handle, listener);
        } catch (CancellationException e) {
            LOGGER.info("Run {} cancelled", handle.id());
            listener.onProgress("Processing cancelled.", null);
            throw e;
        } catch (Exception e) {
            LOGGER.error("Run {} failed", handle.id(), e);
            listener.onProgress("Error during processing: " + describe(e), null);
            throw e;
        } finally {
            supervisor.release(handle);
        }
    }

    public boolean cancel() {
        return supervisor.cancelCurrent();
    }

    private IngestionResult describeDryRun(IngestionRequest request, ProgressListener progress) {
        if (request.isTextImport()) {
            progress.onProgress("Would process FormID list file: " + request.formIdListPath(), null);
            return IngestionResult.dryRun();
        }
        for (String plugin : request.selectedPlugins()) {
            progress.onProgress("Would process " + plugin, null);
            if (request.updateMode()) {
                progress.onProgress("Would clear existing entries for " + plugin, null);
            }
        }
        return IngestionResult.dryRun();
    }

    private IngestionResult execute(IngestionRequest request, RunHandle handle, ProgressListener progress)
            throws Exception {
        if (!request.isTextImport()) {
            recordExtractor.requireDecoder(request.release());
        }
        store.initializeSchema(request.databasePath(), request.release());
        IngestionResult result;
        try (Connection connection = store.open(request.databasePath())) {
            if (request.isTextImport()) {
                TextListSummary summary = textListExtractor.processList(request.formIdListPath(), connection,
                        request.release(), request.updateMode(), handle, progress);
                LOGGER.info("Text import finished: {} plugins, {} records", summary.pluginCount(), summary.recordCount());
                result = IngestionResult.of(summary.pluginCount(), 0);
            } else {
                result = processPlugins(request, connection, handle, progress);
            }
            handle.throwIfCancelled();
            compact(connection);
        }
        progress.onProgress(result.summary(), 100.0);
        return result;
    }

    private IngestionResult processPlugins(IngestionRequest request,
                                           Connection connection,
                                           RunHandle handle,
                                           ProgressListener progress) throws Exception {
        progress.onProgress("Initializing plugin processing...", 0.0);
        LoadOrderSnapshot loadOrder = loadOrderResolver.buildSnapshot(request.release(),
                DataPaths.resolveDataPath(request.gameDirectory()), true);

        List<String> plugins = request.selectedPlugins();
        int total = plugins.size();
        int succeeded = 0;
        int failed = 0;
        for (int i = 0; i < total; i++) {
            handle.throwIfCancelled();
            String plugin = plugins.get(i);
            progress.onProgress("Processing plugin " + (i + 1) + " of " + total + ": " + plugin,
                    (double) i / total * 100);
            try {
                recordExtractor.processPlugin(request.gameDirectory(), connection, request.release(), plugin,
                        loadOrder, request.updateMode(), handle);
                succeeded++;
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                failed++;
                LOGGER.warn("Plugin {} failed", plugin, e);
                errors.warn("Failed to process plugin " + plugin + ": " + describe(e));
                errors.info("Continuing with next plugin...");
            }
        }
        return IngestionResult.of(succeeded, failed);
    }

    private void compact(Connection connection) {
        try {
            store.optimize(connection);
        } catch (SQLException e) {
            // rows are already committed
            LOGGER.warn("Database compaction failed", e);
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private final class IngestionAgentTask implements AgentTask<IngestionResult> {
        private final IngestionRequest request;
        private final ProgressListener progress;

        private IngestionAgentTask(IngestionRequest request, ProgressListener progress) {
            this.request = request;
            this.progress = progress;
        }

        @Override
        public String name() {
            return "ingestion";
        }

        @Override
        public IngestionResult run() throws Exception {
            return IngestionOrchestrator.this.run(request, progress);
        }
    }
}
