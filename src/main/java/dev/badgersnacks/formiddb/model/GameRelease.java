package dev.badgersnacks.formiddb.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Supported game releases. This enum is the only place a database table name is derived from, so
 * no caller-supplied string ever reaches a SQL statement as an identifier.
 */
public enum GameRelease {
    SKYRIM_LE("SkyrimLE", false, BasePlugins.SKYRIM),
    SKYRIM_SE("SkyrimSE", true, BasePlugins.SKYRIM),
    SKYRIM_SE_GOG("SkyrimSEGog", true, BasePlugins.SKYRIM),
    SKYRIM_VR("SkyrimVR", true, BasePlugins.SKYRIM),
    ENDERAL_LE("EnderalLE", false, List.of()),
    ENDERAL_SE("EnderalSE", true, List.of()),
    FALLOUT_4("Fallout4", true, BasePlugins.FALLOUT_4),
    FALLOUT_4_VR("Fallout4VR", true, BasePlugins.FALLOUT_4),
    STARFIELD("Starfield", true, BasePlugins.STARFIELD),
    OBLIVION("Oblivion", false, List.of());

    private final String tableName;
    private final boolean separatedMasterLoadOrders;
    private final List<String> basePlugins;
    private final Set<String> basePluginLookup;

    GameRelease(String tableName, boolean separatedMasterLoadOrders, List<String> basePlugins) {
        this.tableName = tableName;
        this.separatedMasterLoadOrders = separatedMasterLoadOrders;
        this.basePlugins = basePlugins;
        Set<String> lookup = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        lookup.addAll(basePlugins);
        this.basePluginLookup = lookup;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Whether light/medium masters are addressed separately from full masters, which is when the
     * decoder needs per-plugin master styles.
     */
    public boolean usesSeparatedMasterLoadOrders() {
        return separatedMasterLoadOrders;
    }

    /**
     * Official masters in canonical load order.
     */
    public List<String> basePlugins() {
        return basePlugins;
    }

    public boolean isBasePlugin(String pluginFileName) {
        return pluginFileName != null && basePluginLookup.contains(pluginFileName);
    }

    /**
     * Accepts either the enum constant ({@code SKYRIM_SE}) or the table name ({@code SkyrimSE}),
     * case-insensitively.
     */
    public static GameRelease fromName(String name) {
        Objects.requireNonNull(name, "name");
        String trimmed = name.trim();
        for (GameRelease release : values()) {
            if (release.name().equalsIgnoreCase(trimmed) || release.tableName.equalsIgnoreCase(trimmed)) {
                return release;
            }
        }
        throw new IllegalArgumentException("Unsupported game release: " + name);
    }

    @Override
    public String toString() {
        return tableName;
    }

    private static final class BasePlugins {
        private static final List<String> SKYRIM = List.of(
                "Skyrim.esm", "Update.esm", "Dawnguard.esm", "HearthFires.esm",
                "Dragonborn.esm", "ccBGSSSE001-Fish.esm", "ccQDRSSE001-SurvivalMode.esm");
        private static final List<String> FALLOUT_4 = List.of(
                "Fallout4.esm", "DLCRobot.esm", "DLCworkshop01.esm",
                "DLCCoast.esm", "DLCworkshop02.esm", "DLCworkshop03.esm",
                "DLCNukaWorld.esm");
        private static final List<String> STARFIELD = List.of(
                "Starfield.esm", "BlueprintShips-Starfield.esm",
                "OldMars.esm", "Constellation.esm");

        private BasePlugins() {
        }
    }
}
