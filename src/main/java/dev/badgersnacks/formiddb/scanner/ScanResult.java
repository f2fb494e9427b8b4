package dev.badgersnacks.formiddb.scanner;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link PluginListScanner#refreshList} call. Only a published scan carries names.
 */
public record ScanResult(long generation, Status status, List<String> pluginNames) {

    public ScanResult {
        Objects.requireNonNull(status, "status");
        pluginNames = pluginNames == null ? List.of() : List.copyOf(pluginNames);
    }

    public static ScanResult published(long generation, List<String> pluginNames) {
        return new ScanResult(generation, Status.PUBLISHED, pluginNames);
    }

    public static ScanResult superseded(long generation) {
        return new ScanResult(generation, Status.SUPERSEDED, List.of());
    }

    public static ScanResult failed(long generation) {
        return new ScanResult(generation, Status.FAILED, List.of());
    }

    public enum Status {
        PUBLISHED,
        SUPERSEDED,
        FAILED
    }
}
