package de.mirkosertic.gitwebdiff.difftool;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Read-only git invocations for the commit picker: the current branch and one page of the log.
 */
public class GitHistoryCommands {

    private static final Logger logger = LoggerFactory.getLogger(GitHistoryCommands.class);

    /**
     * One commit per line: full hash, short hash, subject, author name, ISO 8601 author date.
     */
    public static final String LOG_FORMAT = "--pretty=format:%H|%h|%s|%an|%aI";

    private final ProcessLauncher launcher;
    private final String gitExecutable;

    public GitHistoryCommands(final ProcessLauncher launcher, final String gitExecutable) {
        this.launcher = launcher;
        this.gitExecutable = gitExecutable;
    }

    /**
     * Run {@code git rev-parse --abbrev-ref HEAD}.
     *
     * @return the branch name, {@code HEAD} when detached, null if git fails
     */
    public @Nullable String currentBranch(final Path repo, final Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        final List<String> command = List.of(gitExecutable, "rev-parse", "--abbrev-ref", "HEAD");
        final Process process = launcher.launch(command, repo);
        final CompletableFuture<byte[]> stdout = ProcessIo.drain(process.getInputStream());
        final CompletableFuture<byte[]> stderr = ProcessIo.drain(process.getErrorStream());
        GitDiffCommands.awaitExit(process, timeout, command);

        if (process.exitValue() != 0) {
            logger.debug("No branch for {}: {}", repo, ProcessIo.textOf(stderr, 1000));
            return null;
        }
        final String branch = ProcessIo.textOf(stdout, timeout.toMillis());
        return branch.isEmpty() ? null : branch;
    }

    /**
     * Run {@code git log} and return its lines in {@link #LOG_FORMAT}.
     *
     * @param maxCount number of commits to return at most
     * @param skip number of newest commits to skip
     * @throws IOException if git exits with an error code
     * @throws TimeoutException if git does not finish in time, the process is killed
     */
    public List<String> log(final Path repo, final int maxCount, final int skip, final Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        final List<String> command = List.of(gitExecutable, "log", LOG_FORMAT, "-n" + maxCount, "--skip=" + skip);
        logger.debug("Reading history: {}", String.join(" ", command));

        final Process process = launcher.launch(command, repo);
        final CompletableFuture<byte[]> stdout = ProcessIo.drain(process.getInputStream());
        final CompletableFuture<byte[]> stderr = ProcessIo.drain(process.getErrorStream());
        GitDiffCommands.awaitExit(process, timeout, command);

        if (process.exitValue() != 0) {
            throw new IOException("git log failed: " + ProcessIo.textOf(stderr, 1000));
        }

        final String output;
        try {
            output = new String(stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS), StandardCharsets.UTF_8);
        } catch (final ExecutionException e) {
            throw new IOException("Failed to read git log output", e.getCause());
        }
        final List<String> lines = new ArrayList<>();
        for (final String line : output.split("\n")) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        return lines;
    }
}
