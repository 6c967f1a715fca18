package de.mirkosertic.gitwebdiff.watch;

import de.mirkosertic.gitwebdiff.diff.DiffChecksumCalculator;
import de.mirkosertic.gitwebdiff.difftool.FakeGitLauncher;
import de.mirkosertic.gitwebdiff.repo.PublishedDiff;
import de.mirkosertic.gitwebdiff.repo.RepoDescriptor;
import de.mirkosertic.gitwebdiff.repo.RepoFixture;
import de.mirkosertic.gitwebdiff.repo.RepoRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DiffChangeWatcher Tests")
class DiffChangeWatcherTest {

    @TempDir
    Path tempDir;

    private Path repo;
    private FakeGitLauncher git;
    private RepoRegistry registry;
    private DiffChangeWatcher watcher;

    @BeforeEach
    void setUp() throws IOException {
        repo = RepoFixture.createRepo(tempDir, "repo");
        final Path[] trees = RepoFixture.createDiffTrees(tempDir, "repo", 1);
        git = new FakeGitLauncher().difftoolDirectories(trees[0], trees[1]).diffOutput("+first\n");
        registry = new RepoRegistry(RepoFixture.orchestrator(git), List.of());
        registry.initialize(List.of(new RepoDescriptor("repo", repo)));
    }

    @AfterEach
    void tearDown() {
        if (watcher != null) {
            watcher.stop();
        }
        registry.stopAllProcesses();
    }

    @Test
    @DisplayName("Should only update the current checksum when the diff changes externally")
    void shouldDetectExternalChange() {
        watcher = new DiffChangeWatcher(registry, RepoFixture.checksumCalculator(git), Duration.ofSeconds(10));
        final PublishedDiff before = registry.getState(0).getPublished();

        watcher.pollOnce();
        assertThat(watcher.hasChanged(0)).as("Same diff, no change").isFalse();

        git.diffOutput("+second\n");
        watcher.pollOnce();

        final PublishedDiff after = registry.getState(0).getPublished();
        assertThat(watcher.hasChanged(0)).isTrue();
        assertThat(after.initialChecksum()).isEqualTo(before.initialChecksum());
        assertThat(after.pairs()).isEqualTo(before.pairs());
        assertThat(after.generation()).isEqualTo(before.generation());
    }

    @Test
    @DisplayName("Should clear the change flag once the repository is reloaded")
    void shouldResetOnRefresh() {
        watcher = new DiffChangeWatcher(registry, RepoFixture.checksumCalculator(git), Duration.ofSeconds(10));
        git.diffOutput("+second\n");
        watcher.pollOnce();
        assertThat(watcher.hasChanged(0)).isTrue();

        registry.refresh(0, null);

        assertThat(watcher.hasChanged(0)).isFalse();
        assertThat(registry.getState(0).getPublished().initialChecksum())
                .isEqualTo(registry.getState(0).getPublished().currentChecksum());
    }

    @Test
    @DisplayName("Should skip a repository whose checksum cannot be computed")
    void shouldSkipFailedChecksum() {
        watcher = new DiffChangeWatcher(registry, RepoFixture.checksumCalculator(git), Duration.ofSeconds(10));
        final String before = registry.getState(0).getPublished().currentChecksum();

        git.diffExitCode(128);
        watcher.pollOnce();

        assertThat(registry.getState(0).getPublished().currentChecksum()).isEqualTo(before);
        assertThat(watcher.hasChanged(0)).isFalse();
    }

    @Test
    @DisplayName("Should report no change and never poll when disabled")
    void shouldStayIdleWhenDisabled() {
        final DiffChecksumCalculator calculator = mock(DiffChecksumCalculator.class);
        watcher = new DiffChangeWatcher(registry, calculator, Duration.ZERO);

        watcher.start();

        assertThat(watcher.isEnabled()).isFalse();
        assertThat(watcher.hasChanged(0)).isFalse();
        verify(calculator, after(300).never()).compute(any(), any());
    }

    @Test
    @DisplayName("Should poll periodically once started and stop on request")
    void shouldPollPeriodically() {
        final DiffChecksumCalculator calculator = mock(DiffChecksumCalculator.class);
        when(calculator.compute(eq(repo), any())).thenReturn("changed");
        watcher = new DiffChangeWatcher(registry, calculator, Duration.ofMillis(50));

        watcher.start();

        verify(calculator, timeout(2000).atLeast(2)).compute(eq(repo), any());
        assertThat(watcher.hasChanged(0)).isTrue();

        watcher.stop();
        final PublishedDiff stopped = registry.getState(0).getPublished();
        assertThat(stopped.currentChecksum()).isEqualTo("changed");
    }
}
