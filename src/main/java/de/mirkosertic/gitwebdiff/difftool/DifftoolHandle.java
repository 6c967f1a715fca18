package de.mirkosertic.gitwebdiff.difftool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A running difftool helper and the two temporary directories it keeps alive.
 * <p>
 * Closing the handle terminates the helper, after which git removes the directories.
 * {@link #close()} is idempotent and never throws.
 */
public class DifftoolHandle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DifftoolHandle.class);

    private final Process process;
    private final Path leftDirectory;
    private final Path rightDirectory;
    private final Duration stopGrace;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DifftoolHandle(final Process process, final Path leftDirectory, final Path rightDirectory,
                          final Duration stopGrace) {
        this.process = process;
        this.leftDirectory = leftDirectory;
        this.rightDirectory = rightDirectory;
        this.stopGrace = stopGrace;

        process.onExit().thenRun(() -> {
            if (!closed.get()) {
                logger.warn("Difftool helper for {} exited unexpectedly with code {}, temp directories are gone",
                        rightDirectory, process.exitValue());
            }
        });
    }

    public Path getLeftDirectory() {
        return leftDirectory;
    }

    public Path getRightDirectory() {
        return rightDirectory;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            ProcessTermination.terminate(process, stopGrace);
            logger.debug("Difftool helper for {} stopped", rightDirectory);
        } catch (final RuntimeException e) {
            logger.warn("Error stopping difftool helper for {}", rightDirectory, e);
        }
    }

    @Override
    public String toString() {
        return "DifftoolHandle[" + leftDirectory + " <-> " + rightDirectory + "]";
    }
}
