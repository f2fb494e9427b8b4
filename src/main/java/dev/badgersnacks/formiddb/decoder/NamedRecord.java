package dev.badgersnacks.formiddb.decoder;

/**
 * Capability for records that carry a display name.
 */
public interface NamedRecord extends PluginRecord {

    /**
     * Display name, or {@code null} when unset.
     */
    String name();
}
