package de.mirkosertic.gitwebdiff.difftool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads subprocess pipes on daemon threads so callers can wait on them with a deadline.
 */
final class ProcessIo {

    private static final Logger logger = LoggerFactory.getLogger(ProcessIo.class);

    private static final AtomicInteger threadCounter = new AtomicInteger(0);
    private static final ExecutorService ioExecutor = Executors.newCachedThreadPool(r -> {
        final Thread thread = new Thread(r, "process-io-" + threadCounter.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    });

    private ProcessIo() {
    }

    /**
     * Read the stream until EOF.
     */
    static CompletableFuture<byte[]> drain(final InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (in) {
                return in.readAllBytes();
            } catch (final IOException e) {
                throw new UncheckedIOException(e);
            }
        }, ioExecutor);
    }

    /**
     * Read at most {@code count} lines. Fewer lines are returned if the stream ends first.
     * The stream is left open, the process on the other end may still be running.
     */
    static CompletableFuture<List<String>> readLines(final InputStream in, final int count) {
        return CompletableFuture.supplyAsync(() -> {
            final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            final List<String> lines = new ArrayList<>(count);
            try {
                while (lines.size() < count) {
                    final String line = reader.readLine();
                    if (line == null) {
                        break;
                    }
                    lines.add(line);
                }
            } catch (final IOException e) {
                throw new UncheckedIOException(e);
            }
            return lines;
        }, ioExecutor);
    }

    /**
     * Best effort text of a drained stream for diagnostics, empty if it is not available in time.
     */
    static String textOf(final CompletableFuture<byte[]> output, final long timeoutMs) {
        try {
            return new String(output.get(timeoutMs, TimeUnit.MILLISECONDS), StandardCharsets.UTF_8).trim();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (final ExecutionException | TimeoutException e) {
            logger.debug("Process output not available for diagnostics: {}", e.toString());
            return "";
        }
    }
}
