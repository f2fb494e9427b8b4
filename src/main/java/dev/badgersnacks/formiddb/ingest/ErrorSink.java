package dev.badgersnacks.formiddb.ingest;

/**
 * Receives non-fatal problems and informational notices raised while scanning or ingesting.
 */
@FunctionalInterface
public interface ErrorSink {

    ErrorSink NONE = (message, informational) -> {
    };

    /**
     * @param informational {@code true} for notices the user may ignore, {@code false} for problems
     *                      worth acting on
     */
    void report(String message, boolean informational);

    default void warn(String message) {
        report(message, false);
    }

    default void info(String message) {
        report(message, true);
    }
}
