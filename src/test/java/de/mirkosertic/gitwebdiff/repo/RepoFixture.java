package de.mirkosertic.gitwebdiff.repo;

import de.mirkosertic.gitwebdiff.diff.DiffChecksumCalculator;
import de.mirkosertic.gitwebdiff.diff.DiffSnapshotComputer;
import de.mirkosertic.gitwebdiff.diff.DirectoryDiffSnapshotComputer;
import de.mirkosertic.gitwebdiff.difftool.DifftoolLauncher;
import de.mirkosertic.gitwebdiff.difftool.FakeGitLauncher;
import de.mirkosertic.gitwebdiff.difftool.GitDiffCommands;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Repositories on disk plus a fully wired orchestrator running against {@link FakeGitLauncher}.
 */
public final class RepoFixture {

    private RepoFixture() {
    }

    /**
     * A directory that passes repository validation.
     */
    public static Path createRepo(final Path parent, final String name) throws IOException {
        final Path repo = Files.createDirectories(parent.resolve(name));
        Files.createDirectories(repo.resolve(".git"));
        return repo;
    }

    /**
     * Left and right directory with {@code changedFiles} files that differ between the sides.
     *
     * @return {left, right}
     */
    public static Path[] createDiffTrees(final Path parent, final String name, final int changedFiles)
            throws IOException {
        final Path left = Files.createDirectories(parent.resolve(name + "-left"));
        final Path right = Files.createDirectories(parent.resolve(name + "-right"));
        for (int i = 0; i < changedFiles; i++) {
            Files.writeString(left.resolve("file" + i + ".txt"), "before " + i);
            Files.writeString(right.resolve("file" + i + ".txt"), "after " + i);
        }
        Files.writeString(left.resolve("unchanged.txt"), "same");
        Files.writeString(right.resolve("unchanged.txt"), "same");
        return new Path[]{left, right};
    }

    public static RefreshOrchestrator orchestrator(final FakeGitLauncher git) {
        return orchestrator(git, new DirectoryDiffSnapshotComputer());
    }

    public static RefreshOrchestrator orchestrator(final FakeGitLauncher git, final DiffSnapshotComputer computer) {
        final GitDiffCommands commands = FakeGitLauncher.commands(git);
        return new RefreshOrchestrator(
                new DifftoolLauncher(commands, Duration.ofSeconds(1), Duration.ofMillis(500), Duration.ofMillis(200)),
                computer,
                checksumCalculator(git));
    }

    public static DiffChecksumCalculator checksumCalculator(final FakeGitLauncher git) {
        return new DiffChecksumCalculator(FakeGitLauncher.commands(git), Duration.ofSeconds(1));
    }
}
