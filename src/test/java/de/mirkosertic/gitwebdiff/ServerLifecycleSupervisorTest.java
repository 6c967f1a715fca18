package de.mirkosertic.gitwebdiff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("ServerLifecycleSupervisor Tests")
class ServerLifecycleSupervisorTest {

    @Test
    @DisplayName("Should clean up and then exit when the timeout elapses")
    void shouldExitAfterTimeout() throws InterruptedException {
        final List<String> events = new CopyOnWriteArrayList<>();
        final CountDownLatch exited = new CountDownLatch(1);
        final ServerLifecycleSupervisor supervisor = new ServerLifecycleSupervisor(
                () -> events.add("cleanup"),
                code -> {
                    events.add("exit " + code);
                    exited.countDown();
                });

        supervisor.scheduleTimeout(Duration.ofMillis(100));
        assertThat(supervisor.isTimeoutScheduled()).isTrue();

        assertThat(exited.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(events).containsExactly("cleanup", "exit 0");
        assertThat(supervisor.isShutdown()).isTrue();
    }

    @Test
    @DisplayName("Should run the cleanup only once")
    void shouldShutdownOnce() {
        final AtomicInteger cleanups = new AtomicInteger();
        final ServerLifecycleSupervisor supervisor =
                new ServerLifecycleSupervisor(cleanups::incrementAndGet, code -> { });

        supervisor.shutdown();
        supervisor.shutdown();

        assertThat(cleanups).hasValue(1);
    }

    @Test
    @DisplayName("Should not schedule anything for a zero timeout")
    void shouldIgnoreZeroTimeout() {
        final ServerLifecycleSupervisor supervisor = new ServerLifecycleSupervisor(() -> { }, code -> { });

        supervisor.scheduleTimeout(Duration.ZERO);

        assertThat(supervisor.isTimeoutScheduled()).isFalse();
    }

    @Test
    @DisplayName("Should cancel a pending timeout on shutdown")
    void shouldCancelTimeoutOnShutdown() throws InterruptedException {
        final AtomicInteger exits = new AtomicInteger();
        final ServerLifecycleSupervisor supervisor =
                new ServerLifecycleSupervisor(() -> { }, code -> exits.incrementAndGet());

        supervisor.scheduleTimeout(Duration.ofMillis(200));
        supervisor.shutdown();
        Thread.sleep(400);

        assertThat(exits).hasValue(0);
        assertThat(supervisor.isTimeoutScheduled()).isFalse();
    }

    @Test
    @DisplayName("Should contain failures of the cleanup")
    void shouldContainCleanupFailure() {
        final ServerLifecycleSupervisor supervisor = new ServerLifecycleSupervisor(() -> {
            throw new IllegalStateException("boom");
        }, code -> { });

        assertThatCode(supervisor::shutdown).doesNotThrowAnyException();
        assertThat(supervisor.isShutdown()).isTrue();
    }
}
