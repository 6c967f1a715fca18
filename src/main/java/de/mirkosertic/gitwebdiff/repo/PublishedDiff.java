package de.mirkosertic.gitwebdiff.repo;

import de.mirkosertic.gitwebdiff.diff.FilePair;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Everything a reader needs about a repository's diff, published as one immutable value.
 * <p>
 * The generation increases with every refresh. Checksums computed by the watcher are only
 * applied to the generation they were computed for, so a slow watcher cycle can never
 * overwrite the baseline of a refresh that happened in the meantime.
 */
public record PublishedDiff(
        long generation,
        List<String> gitArgs,
        List<FilePair> pairs,
        /** Checksum of the raw diff when this generation was published. */
        @Nullable String initialChecksum,
        /** Latest checksum seen by the watcher. */
        @Nullable String currentChecksum
) {

    public PublishedDiff {
        gitArgs = List.copyOf(gitArgs);
        pairs = List.copyOf(pairs);
    }

    static PublishedDiff empty(final List<String> gitArgs) {
        return new PublishedDiff(0, gitArgs, List.of(), null, null);
    }

    /**
     * True iff both checksums are known and differ.
     */
    public boolean hasChanged() {
        return initialChecksum != null && currentChecksum != null && !currentChecksum.equals(initialChecksum);
    }

    PublishedDiff next(final List<String> newGitArgs, final List<FilePair> newPairs,
                       final @Nullable String checksum) {
        return new PublishedDiff(generation + 1, newGitArgs, newPairs, checksum, checksum);
    }

    PublishedDiff withCurrentChecksum(final @Nullable String checksum) {
        return new PublishedDiff(generation, gitArgs, pairs, initialChecksum, checksum);
    }

    PublishedDiff withoutPairs() {
        return new PublishedDiff(generation, gitArgs, List.of(), initialChecksum, currentChecksum);
    }
}
