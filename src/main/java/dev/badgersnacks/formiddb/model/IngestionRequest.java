package dev.badgersnacks.formiddb.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one ingestion run. Either {@code formIdListPath} is set (text import)
 * or {@code gameDirectory} plus {@code selectedPlugins} describe a plugin run.
 */
public record IngestionRequest(
        Path gameDirectory,
        Path formIdListPath,
        Path databasePath,
        GameRelease release,
        List<String> selectedPlugins,
        boolean updateMode,
        boolean dryRun
) {

    public IngestionRequest {
        Objects.requireNonNull(databasePath, "databasePath");
        Objects.requireNonNull(release, "release");
        selectedPlugins = selectedPlugins == null ? List.of() : List.copyOf(selectedPlugins);
        if (gameDirectory == null && formIdListPath == null) {
            throw new IllegalArgumentException("Either a game directory or a FormID list file is required");
        }
    }

    public static IngestionRequest forPlugins(Path gameDirectory,
                                              Path databasePath,
                                              GameRelease release,
                                              List<String> selectedPlugins,
                                              boolean updateMode,
                                              boolean dryRun) {
        Objects.requireNonNull(gameDirectory, "gameDirectory");
        return new IngestionRequest(gameDirectory, null, databasePath, release, selectedPlugins, updateMode, dryRun);
    }

    public static IngestionRequest forTextList(Path formIdListPath,
                                               Path databasePath,
                                               GameRelease release,
                                               boolean updateMode,
                                               boolean dryRun) {
        Objects.requireNonNull(formIdListPath, "formIdListPath");
        return new IngestionRequest(null, formIdListPath, databasePath, release, List.of(), updateMode, dryRun);
    }

    public boolean isTextImport() {
        return formIdListPath != null;
    }
}
