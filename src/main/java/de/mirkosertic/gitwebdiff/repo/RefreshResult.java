package de.mirkosertic.gitwebdiff.repo;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a refresh. {@code error} is set iff {@code success} is false.
 */
public record RefreshResult(
        boolean success,
        int fileCount,
        String message,
        @Nullable RefreshError error
) {
    public static RefreshResult success(final int fileCount) {
        final String message = fileCount == 0
                ? "Reloaded (0 files - no differences)"
                : "Reloaded " + fileCount + " files";
        return new RefreshResult(true, fileCount, message, null);
    }

    public static RefreshResult failure(final RefreshError error, final String message) {
        return new RefreshResult(false, 0, message, error);
    }
}
