package de.mirkosertic.gitwebdiff.repo;

import de.mirkosertic.gitwebdiff.diff.FilePair;
import de.mirkosertic.gitwebdiff.difftool.DifftoolHandle;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one served repository.
 * <p>
 * Three independent guards keep readers away from slow operations:
 * <ul>
 *     <li>the difftool helper handle, behind {@code processLock}, held only to swap the reference</li>
 *     <li>the published diff (args, pairs, checksums), an immutable value behind an atomic reference</li>
 *     <li>the reload flag, a non-blocking try-lock</li>
 * </ul>
 */
public class RepoState {

    private final RepoDescriptor descriptor;

    private final ReentrantLock processLock = new ReentrantLock();
    private @Nullable DifftoolHandle process;

    private final AtomicReference<PublishedDiff> published;
    private final AtomicBoolean reloadInProgress = new AtomicBoolean(false);

    public RepoState(final RepoDescriptor descriptor, final List<String> gitArgs) {
        this.descriptor = descriptor;
        this.published = new AtomicReference<>(PublishedDiff.empty(gitArgs));
    }

    public RepoDescriptor getDescriptor() {
        return descriptor;
    }

    public String getLabel() {
        return descriptor.label();
    }

    public PublishedDiff getPublished() {
        return published.get();
    }

    public List<FilePair> getSnapshot() {
        return published.get().pairs();
    }

    public List<String> getGitArgs() {
        return published.get().gitArgs();
    }

    public boolean hasChanged() {
        return published.get().hasChanged();
    }

    // ==================== Reload gate ====================

    /**
     * @return false if another reload holds the gate
     */
    boolean tryBeginReload() {
        return reloadInProgress.compareAndSet(false, true);
    }

    void endReload() {
        reloadInProgress.set(false);
    }

    public boolean isReloadInProgress() {
        return reloadInProgress.get();
    }

    // ==================== Process handle ====================

    /**
     * Replace the helper handle and return the previous one, which the caller now owns.
     */
    @Nullable DifftoolHandle swapProcess(final @Nullable DifftoolHandle next) {
        processLock.lock();
        try {
            final DifftoolHandle previous = process;
            process = next;
            return previous;
        } finally {
            processLock.unlock();
        }
    }

    @Nullable DifftoolHandle takeProcess() {
        return swapProcess(null);
    }

    public boolean hasLiveProcess() {
        processLock.lock();
        try {
            return process != null && process.isAlive();
        } finally {
            processLock.unlock();
        }
    }

    // ==================== Published diff ====================

    /**
     * Publish a new generation and reset the change detection baseline to {@code checksum}.
     */
    PublishedDiff publish(final List<String> gitArgs, final List<FilePair> pairs, final @Nullable String checksum) {
        return published.updateAndGet(current -> current.next(gitArgs, pairs, checksum));
    }

    /**
     * Drop the file pairs, their temp directories are gone. Args and checksums stay.
     */
    void clearSnapshot() {
        published.updateAndGet(PublishedDiff::withoutPairs);
    }

    /**
     * Record the latest checksum, provided no refresh published a newer generation since
     * {@code generation} was read.
     *
     * @return false if the checksum was discarded
     */
    public boolean recordCurrentChecksum(final long generation, final @Nullable String checksum) {
        while (true) {
            final PublishedDiff current = published.get();
            if (current.generation() != generation) {
                return false;
            }
            if (published.compareAndSet(current, current.withCurrentChecksum(checksum))) {
                return true;
            }
        }
    }
}
