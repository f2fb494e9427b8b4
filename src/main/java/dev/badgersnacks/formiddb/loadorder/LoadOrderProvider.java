package dev.badgersnacks.formiddb.loadorder;

import dev.badgersnacks.formiddb.model.GameRelease;
import dev.badgersnacks.formiddb.model.MasterStyle;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Source of the game's resolved load order.
 */
public interface LoadOrderProvider {

    /**
     * Plugin file names in load order, as the game would load them.
     */
    List<String> listings(GameRelease release, Path dataPath) throws IOException;

    MasterStyle masterStyle(Path pluginPath, GameRelease release) throws IOException;
}
