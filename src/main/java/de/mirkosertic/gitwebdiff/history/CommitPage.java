package de.mirkosertic.gitwebdiff.history;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of the history, newest first.
 *
 * @param hasMore whether older commits exist beyond this page
 * @param branch  current branch, null if git could not tell
 */
public record CommitPage(
        List<Commit> commits,
        boolean hasMore,
        @Nullable String branch
) {
}
