package de.mirkosertic.gitwebdiff.repo;

import de.mirkosertic.gitwebdiff.difftool.DifftoolStartException;

public enum RefreshError {
    INVALID_REPO,
    ALREADY_IN_PROGRESS,
    DIFF_CHECK_FAILED,
    PROTOCOL_VIOLATION,
    MISSING_DIRECTORIES,
    COMPUTE_FAILED,
    SHUTTING_DOWN;

    static RefreshError from(final DifftoolStartException.Reason reason) {
        return switch (reason) {
            case DIFF_CHECK_FAILED -> DIFF_CHECK_FAILED;
            case PROTOCOL_VIOLATION -> PROTOCOL_VIOLATION;
            case MISSING_DIRECTORIES -> MISSING_DIRECTORIES;
        };
    }
}
