package de.mirkosertic.gitwebdiff.repo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RepoDescriptor Tests")
class RepoDescriptorTest {

    private static final Path BASE = Path.of("/work");

    @Test
    @DisplayName("Should parse an explicit label")
    void shouldParseLabel() {
        final RepoDescriptor descriptor = RepoDescriptor.parse("frontend:/src/web-app", BASE);

        assertThat(descriptor.label()).isEqualTo("frontend");
        assertThat(descriptor.path()).isEqualTo(Path.of("/src/web-app"));
    }

    @Test
    @DisplayName("Should label a plain path with its directory name")
    void shouldDeriveLabel() {
        final RepoDescriptor descriptor = RepoDescriptor.parse("/src/backend/", BASE);

        assertThat(descriptor.label()).isEqualTo("backend");
        assertThat(descriptor.path()).isEqualTo(Path.of("/src/backend"));
    }

    @Test
    @DisplayName("Should resolve relative paths against the base directory")
    void shouldResolveRelativePath() {
        final RepoDescriptor descriptor = RepoDescriptor.parse("lib:../lib", BASE);

        assertThat(descriptor.path()).isEqualTo(Path.of("/lib"));
        assertThat(RepoDescriptor.of(Path.of("/work/./repo")).path()).isEqualTo(Path.of("/work/repo"));
    }
}
