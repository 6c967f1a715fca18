package de.mirkosertic.gitwebdiff.difftool;

/**
 * The difftool helper could not provide the two directories to compare.
 */
public class DifftoolStartException extends Exception {

    public enum Reason {
        /** {@code git diff --quiet} returned an unexpected exit code, timed out or could not run. */
        DIFF_CHECK_FAILED,
        /** The helper did not print two non-empty directory lines in time. */
        PROTOCOL_VIOLATION,
        /** The helper printed paths that are not existing directories. */
        MISSING_DIRECTORIES
    }

    private final Reason reason;

    public DifftoolStartException(final Reason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public DifftoolStartException(final Reason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
