package de.mirkosertic.gitwebdiff.repo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RepoValidator Tests")
class RepoValidatorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should accept a directory containing .git")
    void shouldAcceptValidRepo() throws IOException {
        final Path repo = RepoFixture.createRepo(tempDir, "frontend");

        assertThat(RepoValidator.validateSingleRepo("frontend", repo)).isEqualTo(ValidationResult.ok());
    }

    @Test
    @DisplayName("Should reject bad labels and paths with a precise message")
    void shouldRejectInvalidRepos() throws IOException {
        final Path repo = RepoFixture.createRepo(tempDir, "repo");
        final Path plainDir = Files.createDirectories(tempDir.resolve("plain"));
        final Path file = Files.writeString(tempDir.resolve("file.txt"), "x");

        assertThat(RepoValidator.validateSingleRepo("", repo).error()).isEqualTo("Label cannot be empty");
        assertThat(RepoValidator.validateSingleRepo("a:b", repo).error()).isEqualTo("Label cannot contain colon (:)");
        assertThat(RepoValidator.validateSingleRepo("x", Path.of("relative/repo")).error())
                .isEqualTo("Path must be absolute");
        assertThat(RepoValidator.validateSingleRepo("x", tempDir.resolve("missing")).error())
                .isEqualTo("Path does not exist");
        assertThat(RepoValidator.validateSingleRepo("x", file).error()).isEqualTo("Path is not a directory");
        assertThat(RepoValidator.validateSingleRepo("x", plainDir).error())
                .isEqualTo("Path is not a git repository (no .git directory)");
    }

    @Test
    @DisplayName("Should reject empty lists, duplicate labels and duplicate paths")
    void shouldRejectInvalidLists() throws IOException {
        final Path a = RepoFixture.createRepo(tempDir, "a");
        final Path b = RepoFixture.createRepo(tempDir, "b");

        assertThat(RepoValidator.validateRepoList(List.of()).error()).isEqualTo("Must have at least one repository");
        assertThat(RepoValidator.validateRepoList(List.of(
                new RepoDescriptor("x", a), new RepoDescriptor("x", b))).error())
                .isEqualTo("Duplicate labels: x");
        assertThat(RepoValidator.validateRepoList(List.of(
                new RepoDescriptor("x", a), new RepoDescriptor("y", a.resolve("../a")))).error())
                .isEqualTo("Duplicate paths not allowed");
        assertThat(RepoValidator.validateRepoList(List.of(
                new RepoDescriptor("x", a), new RepoDescriptor("y", tempDir.resolve("nope")))).error())
                .isEqualTo("Invalid repo 'y': Path does not exist");
        assertThat(RepoValidator.validateRepoList(List.of(
                new RepoDescriptor("x", a), new RepoDescriptor("y", b))).valid()).isTrue();
    }

    @Test
    @DisplayName("Should suffix repeated labels")
    void shouldMakeLabelsUnique() {
        final List<RepoDescriptor> unique = RepoValidator.ensureUniqueLabels(List.of(
                new RepoDescriptor("app", Path.of("/a/app")),
                new RepoDescriptor("app", Path.of("/b/app")),
                new RepoDescriptor("lib", Path.of("/c/lib")),
                new RepoDescriptor("app", Path.of("/d/app"))));

        assertThat(unique).extracting(RepoDescriptor::label).containsExactly("app", "app-1", "lib", "app-2");
    }
}
