package dev.badgersnacks.formiddb.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolves the plugin data folder for a game install without depending on any game library.
 */
public final class DataPaths {

    private static final String DATA_FOLDER = "Data";

    private DataPaths() {
    }

    /**
     * Returns {@code gameDirectory} itself when it already is the {@code Data} folder, otherwise
     * {@code gameDirectory/Data}.
     */
    public static Path resolveDataPath(Path gameDirectory) {
        Objects.requireNonNull(gameDirectory, "gameDirectory");
        Path fileName = gameDirectory.getFileName();
        if (fileName != null && fileName.toString().equalsIgnoreCase(DATA_FOLDER)) {
            return gameDirectory;
        }
        return gameDirectory.resolve(DATA_FOLDER);
    }

    public static Path resolvePluginPath(Path gameDirectory, String pluginFileName) {
        Objects.requireNonNull(pluginFileName, "pluginFileName");
        return resolveDataPath(gameDirectory).resolve(pluginFileName);
    }
}
