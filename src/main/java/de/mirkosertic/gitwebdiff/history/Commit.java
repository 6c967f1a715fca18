package de.mirkosertic.gitwebdiff.history;

/**
 * One entry of the commit history.
 *
 * @param date     author date in ISO 8601, as git prints it
 * @param relative age of the commit for display, e.g. {@code 3d ago}
 */
public record Commit(
        String hash,
        String shortHash,
        String message,
        String author,
        String date,
        String relative
) {
}
