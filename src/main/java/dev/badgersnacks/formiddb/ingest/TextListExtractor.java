package dev.badgersnacks.formiddb.ingest;

import dev.badgersnacks.formiddb.model.GameRelease;
import dev.badgersnacks.formiddb.model.RecordRow;
import dev.badgersnacks.formiddb.model.RunHandle;
import dev.badgersnacks.formiddb.store.BatchBuffer;
import dev.badgersnacks.formiddb.store.BatchedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Imports {@code plugin|formid|entry} lines from a FormID list export.
 *
 * <p>The file is streamed, never loaded whole. Batches never span two plugins, so in update mode a
 * plugin's rows are always cleared before any of its new rows are written.
 */
public class TextListExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextListExtractor.class);
    private static final int READ_BUFFER_SIZE = 81920;
    private static final char DELIMITER = '|';

    public static final int DEFAULT_BATCH_SIZE = 10_000;
    public static final int DEFAULT_PROGRESS_INTERVAL = 1_000;

    private final BatchedStore store;
    private final int batchSize;
    private final int progressInterval;

    public TextListExtractor(BatchedStore store) {
        this(store, DEFAULT_BATCH_SIZE, DEFAULT_PROGRESS_INTERVAL);
    }

    public TextListExtractor(BatchedStore store, int batchSize, int progressInterval) {
        this.store = Objects.requireNonNull(store, "store");
        if (batchSize <= 0 || progressInterval <= 0) {
            throw new IllegalArgumentException("batchSize and progressInterval must be positive");
        }
        this.batchSize = batchSize;
        this.progressInterval = progressInterval;
    }

    public TextListSummary processList(Path formIdListPath,
                                       Connection connection,
                                       GameRelease release,
                                       boolean updateMode,
                                       RunHandle handle,
                                       ProgressListener progress) throws IOException, SQLException {
        if (!Files.isRegularFile(formIdListPath)) {
            throw new NoSuchFileException(formIdListPath.toString(), null, "FormID list file not found");
        }
        long totalBytes = Files.size(formIdListPath);
        Set<String> seenPlugins = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        BatchBuffer<RecordRow> buffer = new BatchBuffer<>(batchSize,
                batch -> store.insertBatch(connection, release, batch, handle));
        String currentPlugin = null;
        long recordCount = 0;

        progress.onProgress("Starting processing...", 0.0);
        try (CountingInputStream counter = new CountingInputStream(Files.newInputStream(formIdListPath));
             BufferedReader reader = new BufferedReader(
                     new InputStreamReader(counter, StandardCharsets.UTF_8), READ_BUFFER_SIZE)) {
            while (true) {
                handle.throwIfCancelled();
                String line = reader.readLine();
                if (line == null) {
                    break;
                }
                RecordRow row = parseLine(line);
                if (row == null) {
                    continue;
                }
                recordCount++;
                if (recordCount % progressInterval == 0) {
                    double percent = totalBytes > 0 ? (double) counter.count() / totalBytes * 100 : 0;
                    percent = Math.min(percent, 100);
                    progress.onProgress(String.format(Locale.ROOT, "Processing: %.1f%% (%,d records)",
                            percent, recordCount), percent);
                }

                if (currentPlugin == null || !currentPlugin.equalsIgnoreCase(row.plugin())) {
                    buffer.flush();
                    currentPlugin = row.plugin();
                    if (seenPlugins.add(currentPlugin) && updateMode) {
                        progress.onProgress("Processing plugin: " + currentPlugin, null);
                        store.clearPluginEntries(connection, release, currentPlugin);
                    }
                }
                buffer.add(row);
            }
            buffer.flush();
        }

        LOGGER.info("Imported {} records for {} plugins from {}", recordCount, seenPlugins.size(), formIdListPath);
        progress.onProgress(String.format(Locale.ROOT, "Completed processing %d plugins (%,d total records)",
                seenPlugins.size(), recordCount), 100.0);
        return new TextListSummary(seenPlugins.size(), recordCount);
    }

    /**
     * Splits on exactly two {@code |}. Returns {@code null} for blank lines and any other delimiter
     * count.
     */
    static RecordRow parseLine(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        if (line.charAt(0) == '\uFEFF') {
            line = line.substring(1);
        }
        int first = line.indexOf(DELIMITER);
        if (first < 0) {
            return null;
        }
        int second = line.indexOf(DELIMITER, first + 1);
        if (second < 0 || line.indexOf(DELIMITER, second + 1) >= 0) {
            return null;
        }
        return new RecordRow(
                line.substring(0, first).trim(),
                line.substring(first + 1, second).trim(),
                line.substring(second + 1).trim());
    }

    /**
     * Tracks bytes handed to the reader so progress needs no per-line byte counting.
     */
    private static final class CountingInputStream extends FilterInputStream {
        private long count;

        private CountingInputStream(InputStream in) {
            super(in);
        }

        long count() {
            return count;
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b >= 0) {
                count++;
            }
            return b;
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            int read = super.read(buffer, offset, length);
            if (read > 0) {
                count += read;
            }
            return read;
        }

        @Override
        public long skip(long n) throws IOException {
            long skipped = super.skip(n);
            count += skipped;
            return skipped;
        }
    }
}
