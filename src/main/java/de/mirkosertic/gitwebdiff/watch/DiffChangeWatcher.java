package de.mirkosertic.gitwebdiff.watch;

import de.mirkosertic.gitwebdiff.diff.DiffChecksumCalculator;
import de.mirkosertic.gitwebdiff.repo.PublishedDiff;
import de.mirkosertic.gitwebdiff.repo.RepoRegistry;
import de.mirkosertic.gitwebdiff.repo.RepoState;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the raw diff checksum of every repository and records it as the current checksum.
 * <p>
 * The watcher only detects staleness, it never reloads. A client sees the change through
 * {@link #hasChanged(int)} and decides itself whether to request a reload.
 */
public class DiffChangeWatcher {

    private static final Logger logger = LoggerFactory.getLogger(DiffChangeWatcher.class);

    private final RepoRegistry registry;
    private final DiffChecksumCalculator checksumCalculator;
    private final Duration interval;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile @Nullable ScheduledExecutorService scheduler;

    /**
     * @param interval poll interval, zero or negative disables watching
     */
    public DiffChangeWatcher(final RepoRegistry registry, final DiffChecksumCalculator checksumCalculator,
                             final Duration interval) {
        this.registry = registry;
        this.checksumCalculator = checksumCalculator;
        this.interval = interval;
    }

    public boolean isEnabled() {
        return !interval.isZero() && !interval.isNegative();
    }

    /**
     * @return true iff watching is enabled and the repository's diff moved away from its published baseline
     */
    public boolean hasChanged(final int repoIndex) {
        return isEnabled() && registry.hasChanged(repoIndex);
    }

    /**
     * Start polling. Does nothing when disabled or already started.
     */
    public void start() {
        if (!isEnabled() || !started.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "diff-change-watcher");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::pollSafely, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        logger.info("Watch started for {} repos (polling every {}s)", registry.size(), interval.toSeconds());
    }

    public void stop() {
        final ScheduledExecutorService current = scheduler;
        if (current == null) {
            return;
        }
        scheduler = null;
        current.shutdownNow();
        try {
            if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Watcher did not terminate within 5 seconds");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Watch stopped");
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (final Exception e) {
            // Must catch all exceptions: ScheduledExecutorService silently cancels
            // the periodic task if the Runnable throws any uncaught exception.
            logger.error("Watch cycle failed", e);
        }
    }

    /**
     * Run one poll cycle over all repositories.
     */
    void pollOnce() {
        for (final RepoState state : registry.getStates()) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            try {
                poll(state);
            } catch (final RuntimeException e) {
                logger.error("Error checking repo '{}'", state.getLabel(), e);
            }
        }
    }

    private void poll(final RepoState state) {
        final PublishedDiff published = state.getPublished();
        final String checksum = checksumCalculator.compute(state.getDescriptor().path(), published.gitArgs());
        if (checksum == null) {
            return;
        }
        if (!Objects.equals(checksum, published.currentChecksum())) {
            logger.info("Diff change detected in repo '{}' - old: {}, new: {}", state.getLabel(),
                    DiffChecksumCalculator.abbreviate(published.currentChecksum()),
                    DiffChecksumCalculator.abbreviate(checksum));
        }
        if (!state.recordCurrentChecksum(published.generation(), checksum)) {
            logger.debug("Discarded checksum for '{}', a reload published a newer diff", state.getLabel());
        }
    }
}
