package de.mirkosertic.gitwebdiff.diff;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("DirectoryDiffSnapshotComputer Tests")
class DirectoryDiffSnapshotComputerTest {

    @TempDir
    Path tempDir;

    private Path left;
    private Path right;
    private final DirectoryDiffSnapshotComputer computer = new DirectoryDiffSnapshotComputer();

    @BeforeEach
    void setUp() throws IOException {
        left = Files.createDirectories(tempDir.resolve("left"));
        right = Files.createDirectories(tempDir.resolve("right"));
    }

    @Test
    @DisplayName("Should report a single modified file as one change")
    void shouldReportSingleChange() throws IOException {
        write(left, "src/Main.java", "class Main {}");
        write(right, "src/Main.java", "class Main { int x; }");

        final List<FilePair> pairs = computer.compute(left, right);

        assertThat(pairs).hasSize(1);
        final FilePair pair = pairs.get(0);
        assertThat(pair.type()).isEqualTo(FilePair.ChangeType.CHANGE);
        assertThat(pair.a()).isEqualTo("src/Main.java");
        assertThat(pair.b()).isEqualTo("src/Main.java");
        assertThat(pair.aPath()).isEqualTo(left.resolve("src/Main.java"));
        assertThat(pair.sizeB()).isEqualTo("class Main { int x; }".length());
    }

    @Test
    @DisplayName("Should skip files with identical content")
    void shouldSkipIdenticalFiles() throws IOException {
        write(left, "README.md", "same");
        write(right, "README.md", "same");

        assertThat(computer.compute(left, right)).isEmpty();
    }

    @Test
    @DisplayName("Should classify additions, deletions and moves")
    void shouldClassifyAddDeleteMove() throws IOException {
        write(left, "old-name.txt", "moved content");
        write(right, "new-name.txt", "moved content");
        write(left, "removed.txt", "bye");
        write(right, "added.txt", "hello");

        final List<FilePair> pairs = computer.compute(left, right);

        assertThat(pairs)
                .as("Sorted by display name")
                .extracting(FilePair::a, FilePair::b, FilePair::type)
                .containsExactly(
                        tuple(null, "added.txt", FilePair.ChangeType.ADD),
                        tuple("old-name.txt", "new-name.txt", FilePair.ChangeType.MOVE),
                        tuple("removed.txt", null, FilePair.ChangeType.DELETE));
    }

    @Test
    @DisplayName("Should return an empty list for two empty directories")
    void shouldHandleEmptyDirectories() throws IOException {
        assertThat(computer.compute(left, right)).isEmpty();
    }

    private static void write(final Path root, final String relative, final String content) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
