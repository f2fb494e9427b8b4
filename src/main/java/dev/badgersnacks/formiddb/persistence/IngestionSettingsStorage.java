package dev.badgersnacks.formiddb.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes {@link IngestionSettings} at %USERPROFILE%/.formid-database-manager/settings.json
 * unless another file is given. A missing or unreadable file yields the defaults.
 */
public final class IngestionSettingsStorage {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionSettingsStorage.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path settingsFile;

    public IngestionSettingsStorage() {
        this(defaultLocation());
    }

    public IngestionSettingsStorage(Path settingsFile) {
        this.settingsFile = Objects.requireNonNull(settingsFile, "settingsFile");
    }

    public static Path defaultLocation() {
        return Path.of(System.getProperty("user.home"), ".formid-database-manager", "settings.json");
    }

    public Path getSettingsFile() {
        return settingsFile;
    }

    public IngestionSettings load() {
        if (!Files.isRegularFile(settingsFile)) {
            LOGGER.debug("No settings file at {}; using defaults", settingsFile);
            return IngestionSettings.defaults();
        }
        try {
            IngestionSettings settings = MAPPER.readValue(settingsFile.toFile(), IngestionSettings.class);
            if (settings == null) {
                LOGGER.warn("Settings file {} is empty; using defaults", settingsFile);
                return IngestionSettings.defaults();
            }
            LOGGER.info("Loaded ingestion settings from {}", settingsFile);
            return settings;
        } catch (IOException e) {
            LOGGER.warn("Failed to read ingestion settings from {}; using defaults", settingsFile, e);
            return IngestionSettings.defaults();
        }
    }

    public void save(IngestionSettings settings) throws IOException {
        Objects.requireNonNull(settings, "settings");
        Path parent = settingsFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(settingsFile.toFile(), settings);
    }
}
