package dev.badgersnacks.formiddb.loadorder;

import dev.badgersnacks.formiddb.model.MasterStyle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable view of the load order at the time a run or scan started.
 */
public final class LoadOrderSnapshot {

    private final List<String> listedPluginNames;
    private final Set<String> membership;
    private final Map<String, MasterStyle> masterStyles;
    private final Map<String, MasterStyle> masterStyleLookup;

    public LoadOrderSnapshot(List<String> listedPluginNames, Map<String, MasterStyle> masterStyles) {
        this.listedPluginNames = List.copyOf(listedPluginNames);
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        names.addAll(this.listedPluginNames);
        this.membership = Collections.unmodifiableSet(names);
        if (masterStyles == null) {
            this.masterStyles = null;
            this.masterStyleLookup = Map.of();
        } else {
            this.masterStyles = Collections.unmodifiableMap(new LinkedHashMap<>(masterStyles));
            Map<String, MasterStyle> lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            lookup.putAll(masterStyles);
            this.masterStyleLookup = Collections.unmodifiableMap(lookup);
        }
    }

    public List<String> listedPluginNames() {
        return listedPluginNames;
    }

    public boolean containsPlugin(String pluginName) {
        return pluginName != null && membership.contains(pluginName);
    }

    public boolean hasMasterStyles() {
        return masterStyles != null && !masterStyles.isEmpty();
    }

    /**
     * Master styles in load order, or an empty map when they were not requested.
     */
    public Map<String, MasterStyle> masterStyles() {
        return masterStyles == null ? Map.of() : masterStyles;
    }

    public Optional<MasterStyle> masterStyleOf(String pluginName) {
        return Optional.ofNullable(pluginName == null ? null : masterStyleLookup.get(pluginName));
    }
}
