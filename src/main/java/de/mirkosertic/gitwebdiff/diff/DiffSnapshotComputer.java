package de.mirkosertic.gitwebdiff.diff;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns the two directories materialized by the difftool helper into the list of compared files.
 * Implementations keep no state between calls.
 */
@FunctionalInterface
public interface DiffSnapshotComputer {

    List<FilePair> compute(Path leftDirectory, Path rightDirectory) throws IOException;
}
