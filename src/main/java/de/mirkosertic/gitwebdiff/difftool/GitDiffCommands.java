package de.mirkosertic.gitwebdiff.difftool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The three git invocations the server depends on:
 * <ul>
 *     <li>{@code git diff --quiet}: exit code 0 = identical, 1 = differs, anything else = error</li>
 *     <li>{@code git difftool -d -x <wrapper>}: long lived, prints the two temp directories</li>
 *     <li>{@code git diff}: raw textual diff, hashed for change detection</li>
 * </ul>
 */
public class GitDiffCommands {

    private static final Logger logger = LoggerFactory.getLogger(GitDiffCommands.class);

    public static final int EXIT_IDENTICAL = 0;
    public static final int EXIT_DIFFERS = 1;

    private final ProcessLauncher launcher;
    private final String gitExecutable;
    private final Path wrapperScript;

    public GitDiffCommands(final ProcessLauncher launcher, final String gitExecutable, final Path wrapperScript) {
        this.launcher = launcher;
        this.gitExecutable = gitExecutable;
        this.wrapperScript = wrapperScript;
    }

    /**
     * Run {@code git diff --quiet} and return its exit code.
     *
     * @throws TimeoutException if git does not finish in time, the process is killed
     */
    public int quietDiff(final List<String> gitArgs, final Path workingDirectory, final Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        final List<String> command = command(List.of("diff", "--quiet"), gitArgs);
        logger.debug("Checking for differences: {}", String.join(" ", command));

        final Process process = launcher.launch(command, workingDirectory);
        ProcessIo.drain(process.getInputStream());
        final CompletableFuture<byte[]> stderr = ProcessIo.drain(process.getErrorStream());
        awaitExit(process, timeout, command);

        final int exitCode = process.exitValue();
        if (exitCode > EXIT_DIFFERS) {
            logger.error("git diff --quiet failed with exit code {} in {}: {}",
                    exitCode, workingDirectory, ProcessIo.textOf(stderr, 1000));
        }
        return exitCode;
    }

    /**
     * Start {@code git difftool -d} with the wrapper as external tool. The returned process keeps running.
     */
    public Process startDifftool(final List<String> gitArgs, final Path workingDirectory) throws IOException {
        final List<String> command = command(List.of("difftool", "-d", "-x", wrapperScript.toString()), gitArgs);
        logger.info("Starting git difftool: {}", String.join(" ", command));
        return launcher.launch(command, workingDirectory);
    }

    /**
     * Run {@code git diff} and return its raw standard output.
     *
     * @throws IOException if git exits with an error code
     * @throws TimeoutException if git does not finish in time, the process is killed
     */
    public byte[] rawDiff(final List<String> gitArgs, final Path workingDirectory, final Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        final List<String> command = command(List.of("diff"), gitArgs);
        final Process process = launcher.launch(command, workingDirectory);
        final CompletableFuture<byte[]> stdout = ProcessIo.drain(process.getInputStream());
        final CompletableFuture<byte[]> stderr = ProcessIo.drain(process.getErrorStream());
        awaitExit(process, timeout, command);

        final int exitCode = process.exitValue();
        if (exitCode != EXIT_IDENTICAL && exitCode != EXIT_DIFFERS) {
            throw new IOException("git diff exited with code " + exitCode + " in " + workingDirectory
                    + ": " + ProcessIo.textOf(stderr, 1000));
        }

        try {
            return stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final ExecutionException e) {
            throw new IOException("Failed to read git diff output", e.getCause());
        }
    }

    private List<String> command(final List<String> subcommand, final List<String> gitArgs) {
        final List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(subcommand);
        command.addAll(gitArgs);
        return command;
    }

    static void awaitExit(final Process process, final Duration timeout, final List<String> command)
            throws InterruptedException, TimeoutException {
        final boolean exited;
        try {
            exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            ProcessTermination.kill(process);
            throw e;
        }
        if (!exited) {
            ProcessTermination.kill(process);
            throw new TimeoutException(String.join(" ", command) + " timed out after " + timeout.toSeconds() + "s");
        }
    }
}
