package de.mirkosertic.gitwebdiff.diff;

import org.jspecify.annotations.Nullable;

/**
 * Before and after text of one {@link FilePair}.
 * <p>
 * When the pair has overlong lines and truncation is allowed, only the counts are reported
 * and both contents are null.
 */
public record FileContents(
        boolean truncated,
        int truncatedLines,
        long truncatedBytes,
        @Nullable String contentA,
        @Nullable String contentB
) {
    static FileContents withLongLines(final int lines, final long bytes) {
        return new FileContents(true, lines, bytes, null, null);
    }

    static FileContents of(final @Nullable String contentA, final @Nullable String contentB) {
        return new FileContents(false, 0, 0, contentA, contentB);
    }
}
