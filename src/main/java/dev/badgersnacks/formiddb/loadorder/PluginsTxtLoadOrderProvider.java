package dev.badgersnacks.formiddb.loadorder;

import dev.badgersnacks.formiddb.model.GameRelease;
import dev.badgersnacks.formiddb.model.MasterStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Default load order source. Reads the game's {@code plugins.txt}; when none can be found the data
 * folder itself is listed with masters ahead of regular plugins.
 */
public class PluginsTxtLoadOrderProvider implements LoadOrderProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginsTxtLoadOrderProvider.class);
    private static final String PLUGINS_FILE_NAME = "plugins.txt";
    private static final String[] PLUGIN_EXTENSIONS = {".esm", ".esl", ".esp"};

    private final Path configuredPluginsFile;

    public PluginsTxtLoadOrderProvider() {
        this(null);
    }

    /**
     * @param configuredPluginsFile explicit {@code plugins.txt}, or {@code null} to search next to the
     *                              data folder
     */
    public PluginsTxtLoadOrderProvider(Path configuredPluginsFile) {
        this.configuredPluginsFile = configuredPluginsFile;
    }

    @Override
    public List<String> listings(GameRelease release, Path dataPath) throws IOException {
        Optional<Path> pluginsFile = locatePluginsFile(dataPath);
        if (pluginsFile.isEmpty()) {
            LOGGER.info("No plugins.txt found for {}; listing {}", release, dataPath);
            return listDataFolder(dataPath);
        }
        LOGGER.info("Reading load order for {} from {}", release, pluginsFile.get());
        List<String> listings = new ArrayList<>();
        for (String basePlugin : release.basePlugins()) {
            if (Files.isRegularFile(dataPath.resolve(basePlugin))) {
                listings.add(basePlugin);
            }
        }
        listings.addAll(readPluginsFile(pluginsFile.get()));
        return listings;
    }

    @Override
    public MasterStyle masterStyle(Path pluginPath, GameRelease release) {
        return hasExtension(pluginPath.getFileName().toString(), ".esl") ? MasterStyle.SMALL : MasterStyle.FULL;
    }

    Optional<Path> locatePluginsFile(Path dataPath) {
        if (configuredPluginsFile != null) {
            if (Files.isRegularFile(configuredPluginsFile)) {
                return Optional.of(configuredPluginsFile);
            }
            LOGGER.warn("Configured plugins file {} does not exist", configuredPluginsFile);
        }
        Path inData = dataPath.resolve(PLUGINS_FILE_NAME);
        if (Files.isRegularFile(inData)) {
            return Optional.of(inData);
        }
        Path parent = dataPath.toAbsolutePath().getParent();
        if (parent != null && Files.isRegularFile(parent.resolve(PLUGINS_FILE_NAME))) {
            return Optional.of(parent.resolve(PLUGINS_FILE_NAME));
        }
        return Optional.empty();
    }

    static List<String> readPluginsFile(Path pluginsFile) throws IOException {
        List<String> names = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(pluginsFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = stripByteOrderMark(line).trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                if (trimmed.startsWith("*")) {
                    trimmed = trimmed.substring(1).trim();
                }
                if (!trimmed.isEmpty()) {
                    names.add(trimmed);
                }
            }
        }
        return names;
    }

    private static List<String> listDataFolder(Path dataPath) throws IOException {
        if (!Files.isDirectory(dataPath)) {
            throw new IOException("Data directory " + dataPath + " does not exist");
        }
        List<Path> plugins = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataPath)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry) && extensionRank(entry.getFileName().toString()) >= 0) {
                    plugins.add(entry);
                }
            }
        }
        return plugins.stream()
                .map(path -> path.getFileName().toString())
                .sorted(Comparator.comparingInt(PluginsTxtLoadOrderProvider::extensionRank)
                        .thenComparing(String.CASE_INSENSITIVE_ORDER))
                .toList();
    }

    private static int extensionRank(String fileName) {
        for (int i = 0; i < PLUGIN_EXTENSIONS.length; i++) {
            if (hasExtension(fileName, PLUGIN_EXTENSIONS[i])) {
                return i;
            }
        }
        return -1;
    }

    private static boolean hasExtension(String fileName, String extension) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(extension);
    }

    private static String stripByteOrderMark(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
