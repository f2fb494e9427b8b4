package dev.badgersnacks.formiddb.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Tuning knobs for ingestion runs. Non-positive numbers and missing values fall back to the defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IngestionSettings(
        @JsonProperty("pluginBatchSize") int pluginBatchSize,
        @JsonProperty("textBatchSize") int textBatchSize,
        @JsonProperty("progressInterval") int progressInterval,
        @JsonProperty("scanProgressInterval") int scanProgressInterval,
        @JsonProperty("pluginsFile") String pluginsFile,
        @JsonProperty("ignorableRecordErrors") List<String> ignorableRecordErrors
) {

    public static final int DEFAULT_PLUGIN_BATCH_SIZE = 1000;
    public static final int DEFAULT_TEXT_BATCH_SIZE = 10_000;
    public static final int DEFAULT_PROGRESS_INTERVAL = 1000;
    public static final int DEFAULT_SCAN_PROGRESS_INTERVAL = 10;

    public IngestionSettings {
        pluginBatchSize = positiveOr(pluginBatchSize, DEFAULT_PLUGIN_BATCH_SIZE);
        textBatchSize = positiveOr(textBatchSize, DEFAULT_TEXT_BATCH_SIZE);
        progressInterval = positiveOr(progressInterval, DEFAULT_PROGRESS_INTERVAL);
        scanProgressInterval = positiveOr(scanProgressInterval, DEFAULT_SCAN_PROGRESS_INTERVAL);
        pluginsFile = pluginsFile == null || pluginsFile.isBlank() ? null : pluginsFile.trim();
        ignorableRecordErrors = ignorableRecordErrors == null
                ? List.of()
                : ignorableRecordErrors.stream()
                        .filter(pattern -> pattern != null && !pattern.isBlank())
                        .toList();
    }

    public static IngestionSettings defaults() {
        return new IngestionSettings(0, 0, 0, 0, null, null);
    }

    public Optional<Path> pluginsFilePath() {
        return Optional.ofNullable(pluginsFile).map(Path::of);
    }

    private static int positiveOr(int value, int fallback) {
        return value > 0 ? value : fallback;
    }
}
