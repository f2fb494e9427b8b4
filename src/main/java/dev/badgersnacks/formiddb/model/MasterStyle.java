package dev.badgersnacks.formiddb.model;

/**
 * How a plugin's record references split their bits between the record id and the master index.
 */
public enum MasterStyle {
    FULL,
    MEDIUM,
    SMALL
}
