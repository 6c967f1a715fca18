package de.mirkosertic.gitwebdiff.repo;

import de.mirkosertic.gitwebdiff.diff.DiffChecksumCalculator;
import de.mirkosertic.gitwebdiff.diff.DiffSnapshotComputer;
import de.mirkosertic.gitwebdiff.diff.FilePair;
import de.mirkosertic.gitwebdiff.difftool.DifftoolHandle;
import de.mirkosertic.gitwebdiff.difftool.DifftoolLauncher;
import de.mirkosertic.gitwebdiff.difftool.DifftoolStartException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rebuilds the diff of one repository: stop the old helper, start a new one, compute the
 * file pairs and the checksum baseline, then publish everything in one step.
 * <p>
 * At most one refresh per repository runs at a time; a concurrent attempt fails fast with
 * {@link RefreshError#ALREADY_IN_PROGRESS}. Readers never wait for a refresh.
 */
public class RefreshOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(RefreshOrchestrator.class);

    private final DifftoolLauncher launcher;
    private final DiffSnapshotComputer snapshotComputer;
    private final DiffChecksumCalculator checksumCalculator;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RefreshOrchestrator(final DifftoolLauncher launcher, final DiffSnapshotComputer snapshotComputer,
                               final DiffChecksumCalculator checksumCalculator) {
        this.launcher = launcher;
        this.snapshotComputer = snapshotComputer;
        this.checksumCalculator = checksumCalculator;
    }

    /**
     * Refresh a repository.
     *
     * @param newGitArgs replacement comparison arguments, or {@code null} to keep the current ones
     */
    public RefreshResult refresh(final RepoState state, final @Nullable List<String> newGitArgs) {
        if (closed.get()) {
            return shuttingDown();
        }
        if (!state.tryBeginReload()) {
            logger.info("Reload of '{}' rejected, another reload is running", state.getLabel());
            return RefreshResult.failure(RefreshError.ALREADY_IN_PROGRESS, "Reload already in progress");
        }
        try {
            return doRefresh(state, newGitArgs != null ? List.copyOf(newGitArgs) : state.getGitArgs());
        } finally {
            state.endReload();
        }
    }

    /**
     * Refuse further refreshes. A refresh still running when this is called stops the helper it
     * started instead of keeping it, so once every state's helper is stopped none can reappear.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.info("Refreshes disabled, server is shutting down");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stop the helper of a repository, if any. The published snapshot is left untouched.
     */
    public void stopProcess(final RepoState state) {
        launcher.stop(state.takeProcess());
    }

    private RefreshResult doRefresh(final RepoState state, final List<String> gitArgs) {
        final String label = state.getLabel();
        logger.info("Refreshing '{}' with git args {}", label, gitArgs);

        stopProcess(state);

        final DifftoolHandle handle;
        try {
            handle = launcher.start(gitArgs, state.getDescriptor().path());
        } catch (final DifftoolStartException e) {
            logger.error("Failed to start difftool for '{}': {}", label, e.getMessage());
            // The old helper is gone, so are the files the old pairs point to
            state.clearSnapshot();
            return RefreshResult.failure(RefreshError.from(e.getReason()), e.getMessage());
        }

        if (handle == null) {
            final String checksum = checksumCalculator.compute(state.getDescriptor().path(), gitArgs);
            final PublishedDiff published = state.publish(gitArgs, List.of(), checksum);
            logger.info("'{}' has no differences (generation {}, checksum {})", label, published.generation(),
                    DiffChecksumCalculator.abbreviate(checksum));
            return RefreshResult.success(0);
        }

        final List<FilePair> pairs;
        try {
            pairs = snapshotComputer.compute(handle.getLeftDirectory(), handle.getRightDirectory());
        } catch (final IOException | RuntimeException e) {
            logger.error("Failed to compute diff for '{}'", label, e);
            launcher.stop(handle);
            return RefreshResult.failure(RefreshError.COMPUTE_FAILED, "Failed to compute diff: " + e.getMessage());
        }

        final DifftoolHandle previous = state.swapProcess(handle);
        if (previous != null) {
            // Only possible if someone installed a helper outside the reload gate
            logger.warn("Replacing unexpected helper {} of '{}'", previous, label);
            launcher.stop(previous);
        }
        // Checked after installing the handle, so either this refresh or the shutdown cleanup sees it
        if (closed.get()) {
            logger.info("Server shut down while reloading '{}', stopping the new helper", label);
            launcher.stop(state.takeProcess());
            return shuttingDown();
        }

        final String checksum = checksumCalculator.compute(state.getDescriptor().path(), gitArgs);
        final PublishedDiff published = state.publish(gitArgs, pairs, checksum);
        logger.info("Reloaded '{}': {} files (generation {}, checksum {})", label, pairs.size(),
                published.generation(), DiffChecksumCalculator.abbreviate(checksum));
        return RefreshResult.success(pairs.size());
    }

    private static RefreshResult shuttingDown() {
        return RefreshResult.failure(RefreshError.SHUTTING_DOWN, "Server is shutting down");
    }
}
