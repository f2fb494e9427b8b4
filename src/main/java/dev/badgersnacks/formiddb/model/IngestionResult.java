package dev.badgersnacks.formiddb.model;

import java.util.Objects;

/**
 * Terminal report of a run that was not cancelled. Cancellation is raised, never returned.
 */
public record IngestionResult(Outcome outcome, int succeeded, int failed) {

    public IngestionResult {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static IngestionResult dryRun() {
        return new IngestionResult(Outcome.DRY_RUN, 0, 0);
    }

    public static IngestionResult of(int succeeded, int failed) {
        return new IngestionResult(failed > 0 ? Outcome.COMPLETED_WITH_FAILURES : Outcome.COMPLETED, succeeded, failed);
    }

    public String summary() {
        return switch (outcome) {
            case COMPLETED -> "Processing completed successfully: all " + succeeded + " plugins succeeded.";
            case COMPLETED_WITH_FAILURES -> "Processing completed with " + succeeded + " successful and "
                    + failed + " failed plugins.";
            case DRY_RUN -> "Dry run complete; nothing was written.";
        };
    }

    public enum Outcome {
        COMPLETED,
        COMPLETED_WITH_FAILURES,
        DRY_RUN
    }
}
