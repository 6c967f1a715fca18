package de.mirkosertic.gitwebdiff.repo;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of replacing the repository list.
 */
public record ReplaceResult(boolean success, @Nullable Error error, @Nullable String message) {

    public enum Error {
        VALIDATION_FAILED,
        REFRESH_FAILED,
        CRITICAL_ROLLBACK_FAILURE
    }

    public static ReplaceResult ok() {
        return new ReplaceResult(true, null, null);
    }

    public static ReplaceResult failure(final Error error, final String message) {
        return new ReplaceResult(false, error, message);
    }
}
