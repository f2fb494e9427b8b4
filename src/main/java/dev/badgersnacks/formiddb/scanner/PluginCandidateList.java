package dev.badgersnacks.formiddb.scanner;

import dev.badgersnacks.formiddb.model.PluginListItem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Thread-safe holder for the candidate plugins of the most recent published scan.
 */
public final class PluginCandidateList {

    private final List<PluginListItem> items = new ArrayList<>();

    public synchronized void replaceAll(Collection<PluginListItem> replacement) {
        Objects.requireNonNull(replacement, "replacement");
        items.clear();
        items.addAll(replacement);
    }

    public synchronized void clear() {
        items.clear();
    }

    public synchronized List<PluginListItem> snapshot() {
        return List.copyOf(items);
    }

    public synchronized List<String> selectedNames() {
        return items.stream()
                .filter(PluginListItem::selected)
                .map(PluginListItem::name)
                .toList();
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized boolean isEmpty() {
        return items.isEmpty();
    }
}
