package de.mirkosertic.gitwebdiff.repo;

import de.mirkosertic.gitwebdiff.diff.FilePair;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The ordered set of served repositories and their state.
 * <p>
 * Repositories are addressed by index. The list itself is an immutable value swapped
 * as a whole; single repository refreshes hold the read lock, replacing the whole set
 * holds the write lock, so the two never interleave.
 */
public class RepoRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RepoRegistry.class);

    private final RefreshOrchestrator orchestrator;
    private final List<String> defaultGitArgs;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile List<RepoState> states = List.of();

    public RepoRegistry(final RefreshOrchestrator orchestrator, final List<String> defaultGitArgs) {
        this.orchestrator = orchestrator;
        this.defaultGitArgs = List.copyOf(defaultGitArgs);
    }

    /**
     * Install the initial repository set and load every repository once. Load failures are
     * logged and leave the affected repository with an empty snapshot.
     *
     * @throws IllegalArgumentException if the list does not validate
     */
    public void initialize(final List<RepoDescriptor> descriptors) {
        final ValidationResult validation = RepoValidator.validateRepoList(descriptors);
        if (!validation.valid()) {
            throw new IllegalArgumentException(validation.error());
        }
        lock.writeLock().lock();
        try {
            states = createStates(descriptors);
            for (final RepoState state : states) {
                final RefreshResult result = orchestrator.refresh(state, null);
                if (result.success()) {
                    logger.info("Repo '{}': {}", state.getLabel(), result.message());
                } else {
                    logger.warn("Repo '{}' starts with an empty diff: {}", state.getLabel(), result.message());
                }
            }
            logger.info("Initialized {} repo(s)", states.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<RepoState> getStates() {
        return states;
    }

    public List<RepoDescriptor> getDescriptors() {
        final List<RepoDescriptor> result = new ArrayList<>();
        for (final RepoState state : states) {
            result.add(state.getDescriptor());
        }
        return result;
    }

    public int size() {
        return states.size();
    }

    public List<String> getDefaultGitArgs() {
        return defaultGitArgs;
    }

    public @Nullable RepoState getState(final int repoIndex) {
        final List<RepoState> current = states;
        if (repoIndex < 0 || repoIndex >= current.size()) {
            return null;
        }
        return current.get(repoIndex);
    }

    /**
     * @return index of the repository with the given label, or -1
     */
    public int indexOfLabel(final String label) {
        final List<RepoState> current = states;
        for (int i = 0; i < current.size(); i++) {
            if (current.get(i).getLabel().equals(label)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * The published file pairs of a repository, empty for an unknown index.
     */
    public List<FilePair> getSnapshot(final int repoIndex) {
        final RepoState state = getState(repoIndex);
        return state != null ? state.getSnapshot() : List.of();
    }

    /**
     * True iff the watcher saw a diff different from the one published by the last refresh.
     */
    public boolean hasChanged(final int repoIndex) {
        final RepoState state = getState(repoIndex);
        return state != null && state.hasChanged();
    }

    /**
     * Refresh one repository.
     *
     * @param newGitArgs replacement comparison arguments, or {@code null} to keep the current ones
     */
    public RefreshResult refresh(final int repoIndex, final @Nullable List<String> newGitArgs) {
        lock.readLock().lock();
        try {
            final RepoState state = getState(repoIndex);
            if (state == null) {
                return RefreshResult.failure(RefreshError.INVALID_REPO, "Invalid repo index: " + repoIndex);
            }
            return orchestrator.refresh(state, newGitArgs);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the complete repository set. Either every new repository is loaded, or the
     * previous set is restored and reloaded.
     */
    public ReplaceResult replaceAll(final List<RepoDescriptor> descriptors) {
        final ValidationResult validation = RepoValidator.validateRepoList(descriptors);
        if (!validation.valid()) {
            logger.warn("Rejected repo update: {}", validation.error());
            return ReplaceResult.failure(ReplaceResult.Error.VALIDATION_FAILED, validation.error());
        }

        if (orchestrator.isClosed()) {
            return ReplaceResult.failure(ReplaceResult.Error.REFRESH_FAILED, "Server is shutting down");
        }

        lock.writeLock().lock();
        try {
            final List<RepoState> previous = states;
            final List<RepoDescriptor> previousDescriptors = getDescriptors();

            logger.info("Cleaning up {} difftool process(es) before repo update", previous.size());
            stopAllProcesses();

            final String failure = loadAll(descriptors);
            if (failure == null) {
                logger.info("Successfully updated to {} repos", states.size());
                return ReplaceResult.ok();
            }

            logger.error("Error updating repos, rolling back: {}", failure);
            stopAllProcesses();
            states = previous;
            try {
                for (final RepoState state : previous) {
                    final RefreshResult result = orchestrator.refresh(state, null);
                    if (result.error() == RefreshError.COMPUTE_FAILED) {
                        throw new IllegalStateException(result.message());
                    }
                }
            } catch (final RuntimeException e) {
                logger.error("CRITICAL: Rollback failed: {}", e.getMessage(), e);
                return ReplaceResult.failure(ReplaceResult.Error.CRITICAL_ROLLBACK_FAILURE,
                        "Failed to update repos: " + failure + "; rollback failed: " + e.getMessage());
            }
            logger.info("Restored {} previous repo(s): {}", previous.size(), previousDescriptors);
            return ReplaceResult.failure(ReplaceResult.Error.REFRESH_FAILED, "Failed to update repos: " + failure);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Shut the registry down: no refresh starts afterwards, and every helper is stopped,
     * including one that a refresh running right now is about to install.
     *
     * @param lockTimeout how long to wait for running refreshes and replacements to finish
     */
    public void close(final Duration lockTimeout) {
        orchestrator.close();
        boolean locked = false;
        try {
            locked = lock.writeLock().tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!locked) {
            logger.warn("Repo operations still running after {} ms, stopping helpers anyway", lockTimeout.toMillis());
        }
        try {
            stopAllProcesses();
        } finally {
            if (locked) {
                lock.writeLock().unlock();
            }
        }
    }

    /**
     * Stop the difftool helper of every repository. Snapshots stay published.
     */
    public void stopAllProcesses() {
        for (final RepoState state : states) {
            try {
                orchestrator.stopProcess(state);
            } catch (final RuntimeException e) {
                logger.warn("Error stopping difftool for '{}'", state.getLabel(), e);
            }
        }
    }

    /**
     * Install fresh states for {@code descriptors} and load them.
     *
     * @return the failure message, or {@code null} if every repository loaded
     */
    private @Nullable String loadAll(final List<RepoDescriptor> descriptors) {
        try {
            states = createStates(descriptors);
            logger.info("Initializing {} repos...", states.size());
            for (final RepoState state : states) {
                final RefreshResult result = orchestrator.refresh(state, null);
                if (result.error() == RefreshError.COMPUTE_FAILED) {
                    return "'" + state.getLabel() + "': " + result.message();
                }
                if (!result.success()) {
                    logger.warn("Repo '{}' starts with an empty diff: {}", state.getLabel(), result.message());
                }
            }
            return null;
        } catch (final RuntimeException e) {
            logger.error("Unexpected error loading repos", e);
            return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
    }

    private List<RepoState> createStates(final List<RepoDescriptor> descriptors) {
        final List<RepoState> result = new ArrayList<>(descriptors.size());
        for (final RepoDescriptor descriptor : descriptors) {
            result.add(new RepoState(descriptor.normalized(), defaultGitArgs));
        }
        return List.copyOf(result);
    }
}
