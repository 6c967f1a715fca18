package de.mirkosertic.gitwebdiff.diff;

import de.mirkosertic.gitwebdiff.difftool.FakeGitLauncher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DiffChecksumCalculator Tests")
class DiffChecksumCalculatorTest {

    private static final Path REPO = Path.of("/work/repo");

    @Test
    @DisplayName("Should hash the raw diff output with SHA-256")
    void shouldHashDiffOutput() {
        final FakeGitLauncher git = new FakeGitLauncher().diffOutput("");
        final DiffChecksumCalculator calculator =
                new DiffChecksumCalculator(FakeGitLauncher.commands(git), Duration.ofSeconds(1));

        assertThat(calculator.compute(REPO, List.of()))
                .as("SHA-256 of empty input")
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(git.commands()).containsExactly(List.of("git", "diff"));
    }

    @Test
    @DisplayName("Should produce different checksums for different diffs")
    void shouldDistinguishDiffs() {
        final FakeGitLauncher git = new FakeGitLauncher().diffOutput("+a\n");
        final DiffChecksumCalculator calculator =
                new DiffChecksumCalculator(FakeGitLauncher.commands(git), Duration.ofSeconds(1));

        final String first = calculator.compute(REPO, List.of("HEAD"));
        git.diffOutput("+b\n");
        final String second = calculator.compute(REPO, List.of("HEAD"));

        assertThat(first).isNotNull().hasSize(64);
        assertThat(second).isNotNull().isNotEqualTo(first);
        assertThat(first).isEqualTo(DiffChecksumCalculator.sha256("+a\n".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should return null when git fails")
    void shouldReturnNullOnFailure() {
        final FakeGitLauncher git = new FakeGitLauncher().diffExitCode(128);
        final DiffChecksumCalculator calculator =
                new DiffChecksumCalculator(FakeGitLauncher.commands(git), Duration.ofSeconds(1));

        assertThat(calculator.compute(REPO, List.of())).isNull();
    }

    @Test
    @DisplayName("Should abbreviate checksums for log output")
    void shouldAbbreviate() {
        assertThat(DiffChecksumCalculator.abbreviate(null)).isEqualTo("none");
        assertThat(DiffChecksumCalculator.abbreviate("0123456789abcdef")).isEqualTo("01234567");
    }
}
