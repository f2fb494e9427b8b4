package dev.badgersnacks.formiddb.model;

import java.util.Objects;

/**
 * A selectable candidate plugin shown to the user after a scan.
 */
public final class PluginListItem {

    private final String name;
    private volatile boolean selected;

    public PluginListItem(String name) {
        this(name, false);
    }

    public PluginListItem(String name, boolean selected) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Plugin name is required");
        }
        this.name = name.trim();
        this.selected = selected;
    }

    public String name() {
        return name;
    }

    public boolean selected() {
        return selected;
    }

    public void setSelected(boolean selected) {
        this.selected = selected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PluginListItem other)) {
            return false;
        }
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
