package de.mirkosertic.gitwebdiff.diff;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Pairs files of the left and right directory by relative path.
 * <p>
 * Files present on both sides with different content are changes, files only on one side
 * are deletions or additions. A deletion and an addition with identical content are
 * reported as a single move. Identical files are not part of the snapshot.
 */
public class DirectoryDiffSnapshotComputer implements DiffSnapshotComputer {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryDiffSnapshotComputer.class);

    @Override
    public List<FilePair> compute(final Path leftDirectory, final Path rightDirectory) throws IOException {
        final Map<String, Path> left = collectFiles(leftDirectory);
        final Map<String, Path> right = collectFiles(rightDirectory);

        final List<FilePair> pairs = new ArrayList<>();
        final List<String> deleted = new ArrayList<>();
        final List<String> added = new ArrayList<>();

        final TreeSet<String> allNames = new TreeSet<>(left.keySet());
        allNames.addAll(right.keySet());

        for (final String name : allNames) {
            final Path leftFile = left.get(name);
            final Path rightFile = right.get(name);
            if (leftFile != null && rightFile != null) {
                if (!sameContent(leftFile, rightFile)) {
                    pairs.add(new FilePair(name, name, leftFile, rightFile, FilePair.ChangeType.CHANGE,
                            Files.size(leftFile), Files.size(rightFile)));
                }
            } else if (leftFile != null) {
                deleted.add(name);
            } else {
                added.add(name);
            }
        }

        for (final String deletedName : deleted) {
            final Path leftFile = left.get(deletedName);
            final String movedTo = findMoveTarget(leftFile, added, right);
            if (movedTo != null) {
                added.remove(movedTo);
                final Path rightFile = right.get(movedTo);
                pairs.add(new FilePair(deletedName, movedTo, leftFile, rightFile, FilePair.ChangeType.MOVE,
                        Files.size(leftFile), Files.size(rightFile)));
            } else {
                pairs.add(FilePair.deleted(deletedName, leftFile, Files.size(leftFile)));
            }
        }
        for (final String addedName : added) {
            final Path rightFile = right.get(addedName);
            pairs.add(FilePair.added(addedName, rightFile, Files.size(rightFile)));
        }

        pairs.sort(Comparator.comparing(FilePair::displayName));
        logger.debug("Computed {} file pairs for {} <-> {}", pairs.size(), leftDirectory, rightDirectory);
        return pairs;
    }

    private static @Nullable String findMoveTarget(final Path leftFile, final List<String> added,
                                                   final Map<String, Path> right) throws IOException {
        final long size = Files.size(leftFile);
        for (final String candidate : added) {
            final Path rightFile = right.get(candidate);
            if (Files.size(rightFile) == size && sameContent(leftFile, rightFile)) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean sameContent(final Path leftFile, final Path rightFile) throws IOException {
        return Files.mismatch(leftFile, rightFile) == -1L;
    }

    /**
     * Regular files below {@code root}, keyed by their '/' separated relative path. Symlinks are followed.
     */
    private static Map<String, Path> collectFiles(final Path root) throws IOException {
        final Map<String, Path> files = new TreeMap<>();
        try (final Stream<Path> paths = Files.walk(root)) {
            paths.filter(Files::isRegularFile).forEach(path -> {
                final String relative = root.relativize(path).toString().replace('\\', '/');
                files.put(relative, path);
            });
        } catch (final UncheckedIOException e) {
            throw e.getCause();
        }
        return files;
    }
}
