package dev.badgersnacks.formiddb.ingest;

import dev.badgersnacks.formiddb.decoder.DecodedPlugin;
import dev.badgersnacks.formiddb.decoder.PluginDecoder;
import dev.badgersnacks.formiddb.decoder.PluginDecoders;
import dev.badgersnacks.formiddb.decoder.PluginRecord;
import dev.badgersnacks.formiddb.loadorder.LoadOrderSnapshot;
import dev.badgersnacks.formiddb.model.GameRelease;
import dev.badgersnacks.formiddb.model.RecordRow;
import dev.badgersnacks.formiddb.model.RunHandle;
import dev.badgersnacks.formiddb.store.BatchBuffer;
import dev.badgersnacks.formiddb.store.BatchedStore;
import dev.badgersnacks.formiddb.util.DataPaths;
import dev.badgersnacks.formiddb.util.FormIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Decodes a single plugin and writes one row per major record.
 *
 * <p>The whole plugin, including the update-mode clear, runs in one transaction: a plugin that fails
 * to decode keeps whatever rows it had before. Problems with individual records never abort the
 * plugin.
 */
public class RecordExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordExtractor.class);

    /**
     * Messages produced by malformed-but-harmless subrecords in shipped plugins.
     */
    public static final List<String> DEFAULT_IGNORABLE_ERRORS = List.of(
            "KSIZ",
            "KWDA",
            "Expected EDID",
            "List with a non zero counter",
            "Unexpected record type",
            "Failed to parse record header");

    public static final int DEFAULT_BATCH_SIZE = 1000;

    private final BatchedStore store;
    private final PluginDecoders decoders;
    private final RecordLabelResolver labelResolver;
    private final ErrorSink errors;
    private final int batchSize;
    private final List<String> ignorableErrors;

    public RecordExtractor(BatchedStore store, PluginDecoders decoders, ErrorSink errors) {
        this(store, decoders, new RecordLabelResolver(), errors, DEFAULT_BATCH_SIZE, List.of());
    }

    public RecordExtractor(BatchedStore store,
                           PluginDecoders decoders,
                           RecordLabelResolver labelResolver,
                           ErrorSink errors,
                           int batchSize,
                           List<String> extraIgnorableErrors) {
        this.store = Objects.requireNonNull(store, "store");
        this.decoders = Objects.requireNonNull(decoders, "decoders");
        this.labelResolver = Objects.requireNonNull(labelResolver, "labelResolver");
        this.errors = Objects.requireNonNull(errors, "errors");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
        List<String> patterns = new ArrayList<>(DEFAULT_IGNORABLE_ERRORS);
        if (extraIgnorableErrors != null) {
            extraIgnorableErrors.stream()
                    .filter(pattern -> pattern != null && !pattern.isBlank())
                    .forEach(patterns::add);
        }
        this.ignorableErrors = patterns.stream()
                .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * @return rows written for the plugin; 0 when it was skipped with a warning
     * @throws CancellationException when {@code handle} is cancelled; the plugin's transaction is
     *                               rolled back
     */
    public int processPlugin(Path gameDirectory,
                             Connection connection,
                             GameRelease release,
                             String pluginName,
                             LoadOrderSnapshot loadOrder,
                             boolean updateMode,
                             RunHandle handle) throws SQLException, IOException {
        if (!loadOrder.containsPlugin(pluginName)) {
            errors.warn("Warning: Could not find plugin in load order: " + pluginName);
            return 0;
        }
        Path pluginPath = DataPaths.resolvePluginPath(gameDirectory, pluginName);
        if (!Files.isRegularFile(pluginPath)) {
            errors.warn("Warning: Could not find plugin file: " + pluginPath);
            return 0;
        }
        PluginDecoder decoder = decoders.require(release);

        boolean previousAutoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            if (updateMode) {
                errors.info("Deleting existing entries for " + pluginName);
                store.clearPluginEntries(connection, release, pluginName);
            }
            // decoding cannot be interrupted, so check before committing to it
            handle.throwIfCancelled();
            int written;
            try (DecodedPlugin decoded = decoder.open(pluginPath, release, loadOrder)) {
                written = processRecords(connection, release, pluginName, decoded, handle);
            }
            connection.commit();
            LOGGER.info("Wrote {} rows for {}", written, pluginName);
            return written;
        } catch (CancellationException e) {
            rollback(connection, e);
            throw e;
        } catch (SQLException | IOException | RuntimeException e) {
            errors.warn("Error processing " + pluginName + ": " + describe(e));
            rollback(connection, e);
            throw e;
        } finally {
            connection.setAutoCommit(previousAutoCommit);
        }
    }

    /**
     * Fails fast when no decoder handles {@code release}, before any plugin is touched.
     */
    public PluginDecoder requireDecoder(GameRelease release) {
        return decoders.require(release);
    }

    private int processRecords(Connection connection,
                               GameRelease release,
                               String pluginName,
                               DecodedPlugin decoded,
                               RunHandle handle) throws SQLException {
        PluginBatchWriter writer = new PluginBatchWriter(connection, release, pluginName, handle);
        BatchBuffer<RecordRow> buffer = new BatchBuffer<>(batchSize, writer);
        Iterator<PluginRecord> records = decoded.records().iterator();
        while (records.hasNext()) {
            handle.throwIfCancelled();
            try {
                PluginRecord record = records.next();
                String formId;
                try {
                    formId = FormIds.format(record.formKeyId());
                } catch (RuntimeException e) {
                    LOGGER.trace("Skipping record without a readable FormID in {}", pluginName, e);
                    continue;
                }
                String entry = labelResolver.resolve(record, formId);
                buffer.add(new RecordRow(pluginName, formId, entry));
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                if (isIgnorable(e)) {
                    LOGGER.trace("Ignoring malformed record in {}: {}", pluginName, e.getMessage());
                } else {
                    errors.warn("Warning: Error processing record in " + pluginName + ": " + describe(e));
                }
            }
        }
        buffer.flush();
        return writer.written;
    }

    boolean isIgnorable(Throwable error) {
        // decoders surface missing optional subrecords as null dereferences
        if (error instanceof NullPointerException) {
            return true;
        }
        String message = error.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return ignorableErrors.stream().anyMatch(lower::contains);
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Flushes inside the plugin's transaction; a failed batch is reported and dropped.
     */
    private final class PluginBatchWriter implements BatchBuffer.Flusher<RecordRow> {
        private final Connection connection;
        private final GameRelease release;
        private final String pluginName;
        private final RunHandle handle;
        private int written;

        private PluginBatchWriter(Connection connection, GameRelease release, String pluginName, RunHandle handle) {
            this.connection = connection;
            this.release = release;
            this.pluginName = pluginName;
            this.handle = handle;
        }

        @Override
        public void flush(List<RecordRow> batch) {
            try {
                store.insertBatch(connection, release, batch, handle);
                written += batch.size();
            } catch (SQLException e) {
                LOGGER.warn("Batch insert failed for {}", pluginName, e);
                errors.warn("Warning: Failed to insert batch in " + pluginName + ": " + describe(e));
            }
        }
    }
}
