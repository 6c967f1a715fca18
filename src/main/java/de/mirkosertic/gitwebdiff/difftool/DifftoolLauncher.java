package de.mirkosertic.gitwebdiff.difftool;

import de.mirkosertic.gitwebdiff.difftool.DifftoolStartException.Reason;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts and stops the difftool helper that materializes the two sides of a comparison.
 * <p>
 * Startup is a two step affair: a cheap {@code git diff --quiet} check decides whether there
 * is anything to compare at all, then {@code git difftool -d} is launched and its first two
 * stdout lines are read as the left and right directory.
 */
public class DifftoolLauncher {

    private static final Logger logger = LoggerFactory.getLogger(DifftoolLauncher.class);

    private static final int PROTOCOL_LINES = 2;

    private final GitDiffCommands commands;
    private final Duration checkTimeout;
    private final Duration protocolTimeout;
    private final Duration stopGrace;

    public DifftoolLauncher(final GitDiffCommands commands, final Duration checkTimeout,
                            final Duration protocolTimeout, final Duration stopGrace) {
        this.commands = commands;
        this.checkTimeout = checkTimeout;
        this.protocolTimeout = protocolTimeout;
        this.stopGrace = stopGrace;
    }

    /**
     * Start a helper for the given comparison.
     *
     * @param gitArgs          arguments passed to git diff and git difftool
     * @param workingDirectory the repository to run git in
     * @return the running helper, or {@code null} if there are no differences
     * @throws DifftoolStartException if the check fails or the helper does not deliver usable directories
     */
    public @Nullable DifftoolHandle start(final List<String> gitArgs, final Path workingDirectory)
            throws DifftoolStartException {
        final int exitCode = checkForDifferences(gitArgs, workingDirectory);
        if (exitCode == GitDiffCommands.EXIT_IDENTICAL) {
            logger.info("No differences found in {} (git diff --quiet returned 0)", workingDirectory);
            return null;
        }
        if (exitCode != GitDiffCommands.EXIT_DIFFERS) {
            throw new DifftoolStartException(Reason.DIFF_CHECK_FAILED,
                    "git diff --quiet failed with exit code " + exitCode + " in " + workingDirectory);
        }

        final Process process;
        try {
            process = commands.startDifftool(gitArgs, workingDirectory);
        } catch (final IOException e) {
            throw new DifftoolStartException(Reason.PROTOCOL_VIOLATION,
                    "Failed to start git difftool in " + workingDirectory + ": " + e.getMessage(), e);
        }

        final CompletableFuture<byte[]> stderr = ProcessIo.drain(process.getErrorStream());
        final List<String> lines = readDirectoryLines(process, workingDirectory);

        if (lines.size() < PROTOCOL_LINES || lines.get(0).isBlank() || lines.get(1).isBlank()) {
            ProcessTermination.kill(process);
            logger.error("Failed to read temp directories from difftool wrapper in {}: lines={}, stderr={}",
                    workingDirectory, lines, ProcessIo.textOf(stderr, 1000));
            throw new DifftoolStartException(Reason.PROTOCOL_VIOLATION,
                    "Difftool wrapper did not report two directories (got " + lines.size() + " line(s))");
        }

        final Path left;
        final Path right;
        try {
            left = Path.of(lines.get(0).strip());
            right = Path.of(lines.get(1).strip());
        } catch (final InvalidPathException e) {
            ProcessTermination.kill(process);
            throw new DifftoolStartException(Reason.MISSING_DIRECTORIES,
                    "Difftool wrapper reported an invalid path: " + e.getMessage(), e);
        }

        if (!Files.isDirectory(left) || !Files.isDirectory(right)) {
            ProcessTermination.kill(process);
            logger.error("Temp directories don't exist: {}, {}", left, right);
            throw new DifftoolStartException(Reason.MISSING_DIRECTORIES,
                    "Temp directories don't exist: " + left + ", " + right);
        }

        logger.info("Difftool temp dirs: {}, {}", left, right);
        return new DifftoolHandle(process, left, right, stopGrace);
    }

    /**
     * Stop a helper. Accepts {@code null} and already stopped handles.
     */
    public void stop(final @Nullable DifftoolHandle handle) {
        if (handle != null) {
            handle.close();
        }
    }

    private int checkForDifferences(final List<String> gitArgs, final Path workingDirectory)
            throws DifftoolStartException {
        try {
            return commands.quietDiff(gitArgs, workingDirectory, checkTimeout);
        } catch (final TimeoutException e) {
            throw new DifftoolStartException(Reason.DIFF_CHECK_FAILED,
                    "git diff --quiet timed out in " + workingDirectory, e);
        } catch (final IOException e) {
            throw new DifftoolStartException(Reason.DIFF_CHECK_FAILED,
                    "Error running git diff --quiet in " + workingDirectory + ": " + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DifftoolStartException(Reason.DIFF_CHECK_FAILED, "Interrupted while probing " + workingDirectory, e);
        }
    }

    private List<String> readDirectoryLines(final Process process, final Path workingDirectory)
            throws DifftoolStartException {
        final CompletableFuture<List<String>> lines = ProcessIo.readLines(process.getInputStream(), PROTOCOL_LINES);
        try {
            return lines.get(protocolTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            ProcessTermination.kill(process);
            throw new DifftoolStartException(Reason.PROTOCOL_VIOLATION,
                    "Timed out after " + protocolTimeout.toSeconds() + "s waiting for difftool directories in "
                            + workingDirectory, e);
        } catch (final ExecutionException e) {
            ProcessTermination.kill(process);
            throw new DifftoolStartException(Reason.PROTOCOL_VIOLATION,
                    "Failed to read difftool output: " + e.getCause().getMessage(), e.getCause());
        } catch (final InterruptedException e) {
            ProcessTermination.kill(process);
            Thread.currentThread().interrupt();
            throw new DifftoolStartException(Reason.PROTOCOL_VIOLATION,
                    "Interrupted while waiting for difftool directories", e);
        }
    }
}
