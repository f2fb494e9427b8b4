package dev.badgersnacks.formiddb.ingest;

/**
 * Receives human-readable progress messages with an optional 0-100 percentage.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (message, percent) -> {
    };

    void onProgress(String message, Double percent);
}
