package dev.badgersnacks.formiddb.ingest;

/**
 * Totals from one FormID list import.
 */
public record TextListSummary(int pluginCount, long recordCount) {
}
