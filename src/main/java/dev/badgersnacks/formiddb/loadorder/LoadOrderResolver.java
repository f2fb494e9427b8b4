package dev.badgersnacks.formiddb.loadorder;

import dev.badgersnacks.formiddb.model.GameRelease;
import dev.badgersnacks.formiddb.model.MasterStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link LoadOrderProvider} listing into a {@link LoadOrderSnapshot}. The listing is kept
 * exactly as reported; callers de-duplicate when they need to.
 */
public class LoadOrderResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoadOrderResolver.class);

    private final LoadOrderProvider provider;

    public LoadOrderResolver(LoadOrderProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public LoadOrderSnapshot buildSnapshot(GameRelease release, Path dataPath, boolean includeMasterInfo)
            throws IOException {
        Objects.requireNonNull(release, "release");
        Objects.requireNonNull(dataPath, "dataPath");
        List<String> listings = provider.listings(release, dataPath);
        if (!includeMasterInfo || !release.usesSeparatedMasterLoadOrders()) {
            return new LoadOrderSnapshot(listings, null);
        }

        Map<String, MasterStyle> styles = new LinkedHashMap<>();
        for (String pluginName : listings) {
            Path pluginPath = dataPath.resolve(pluginName);
            if (!Files.isRegularFile(pluginPath)) {
                // listed but not installed
                continue;
            }
            styles.put(pluginName, provider.masterStyle(pluginPath, release));
        }
        LOGGER.debug("Resolved master styles for {} of {} listed plugins", styles.size(), listings.size());
        return new LoadOrderSnapshot(listings, styles);
    }

    public List<String> listedPluginNames(GameRelease release, Path dataPath) throws IOException {
        return buildSnapshot(release, dataPath, false).listedPluginNames();
    }
}
