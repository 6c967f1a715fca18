package de.mirkosertic.gitwebdiff.diff;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * One compared unit of a diff snapshot.
 * <p>
 * {@code a} and {@code b} are paths relative to the left and right directory;
 * one of them is {@code null} for added or deleted files.
 */
public record FilePair(
        /** Relative path on the left ("before") side, null if the file was added. */
        @Nullable String a,
        /** Relative path on the right ("after") side, null if the file was deleted. */
        @Nullable String b,
        /** Absolute path of the left file, null if the file was added. */
        @Nullable Path aPath,
        /** Absolute path of the right file, null if the file was deleted. */
        @Nullable Path bPath,
        ChangeType type,
        long sizeA,
        long sizeB
) {

    public enum ChangeType {
        ADD("add"),
        DELETE("delete"),
        MOVE("move"),
        CHANGE("change");

        private final String label;

        ChangeType(final String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static FilePair added(final String b, final Path bPath, final long sizeB) {
        return new FilePair(null, b, null, bPath, ChangeType.ADD, 0, sizeB);
    }

    public static FilePair deleted(final String a, final Path aPath, final long sizeA) {
        return new FilePair(a, null, aPath, null, ChangeType.DELETE, sizeA, 0);
    }

    /**
     * Name shown in file lists: the new name if there is one, the old name otherwise.
     */
    public String displayName() {
        return b != null ? b : a;
    }
}
