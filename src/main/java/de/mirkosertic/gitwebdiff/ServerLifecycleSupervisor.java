package de.mirkosertic.gitwebdiff;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Owns the end of the server's life: a JVM shutdown hook for signals and a server timeout
 * after which the process exits. Both run the same cleanup, exactly once.
 */
public class ServerLifecycleSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(ServerLifecycleSupervisor.class);

    private final Runnable cleanup;
    private final IntConsumer exitHandler;
    private final AtomicBoolean shutdownDone = new AtomicBoolean(false);
    private final ScheduledExecutorService timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "server-timeout");
        t.setDaemon(true);
        return t;
    });
    private volatile @Nullable ScheduledFuture<?> timeoutFuture;

    public ServerLifecycleSupervisor(final Runnable cleanup) {
        this(cleanup, System::exit);
    }

    ServerLifecycleSupervisor(final Runnable cleanup, final IntConsumer exitHandler) {
        this.cleanup = cleanup;
        this.exitHandler = exitHandler;
    }

    /**
     * Run the cleanup when the JVM terminates, e.g. on SIGINT or SIGTERM.
     */
    public void installShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));
    }

    /**
     * Exit the process once {@code timeout} has elapsed. Zero or negative means run forever.
     */
    public void scheduleTimeout(final Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return;
        }
        timeoutFuture = timeoutScheduler.schedule(this::onTimeout, timeout.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Server will automatically shut down after {} minutes", timeout.toMinutes());
    }

    public boolean isTimeoutScheduled() {
        final ScheduledFuture<?> future = timeoutFuture;
        return future != null && !future.isDone();
    }

    public boolean isShutdown() {
        return shutdownDone.get();
    }

    /**
     * Run the cleanup. Only the first call has an effect, later calls return immediately.
     */
    public void shutdown() {
        if (!shutdownDone.compareAndSet(false, true)) {
            return;
        }
        final ScheduledFuture<?> future = timeoutFuture;
        if (future != null) {
            future.cancel(false);
        }
        timeoutScheduler.shutdown();
        try {
            cleanup.run();
        } catch (final RuntimeException e) {
            logger.error("Error during shutdown cleanup", e);
        }
    }

    private void onTimeout() {
        logger.info("Timeout reached. Shutting down...");
        shutdown();
        exitHandler.accept(0);
    }
}
