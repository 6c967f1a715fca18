package de.mirkosertic.gitwebdiff.difftool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Terminates a process together with the processes it spawned.
 * <p>
 * git difftool runs the wrapper script as a child, which in turn runs {@code sleep}.
 * Destroying only the git process would leave the wrapper behind and the temporary
 * directories alive, so descendants are always collected before the parent goes away.
 */
final class ProcessTermination {

    private static final Logger logger = LoggerFactory.getLogger(ProcessTermination.class);

    private ProcessTermination() {
    }

    /**
     * Ask the process to exit, wait up to {@code grace}, then kill it. Always reaps the exit status.
     */
    static void terminate(final Process process, final Duration grace) {
        final List<ProcessHandle> descendants = descendantsOf(process);
        try {
            descendants.forEach(ProcessHandle::destroy);
            process.destroy();
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Process did not exit within {} ms, killing it", grace.toMillis());
                kill(process, descendants);
                return;
            }
            descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process, descendants);
        }
    }

    /**
     * Kill the process immediately.
     */
    static void kill(final Process process) {
        kill(process, descendantsOf(process));
    }

    private static void kill(final Process process, final List<ProcessHandle> descendants) {
        descendants.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        boolean interrupted = false;
        while (true) {
            try {
                process.waitFor();
                break;
            } catch (final InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static List<ProcessHandle> descendantsOf(final Process process) {
        try {
            return process.descendants().toList();
        } catch (final UnsupportedOperationException e) {
            logger.debug("Process does not expose its descendants");
            return List.of();
        }
    }
}
