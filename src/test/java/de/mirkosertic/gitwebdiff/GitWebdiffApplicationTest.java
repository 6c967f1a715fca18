package de.mirkosertic.gitwebdiff;

import de.mirkosertic.gitwebdiff.config.ApplicationConfig;
import de.mirkosertic.gitwebdiff.repo.RepoDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("GitWebdiffApplication Tests")
class GitWebdiffApplicationTest {

    @Test
    @DisplayName("Should serve the working directory when no repository is given")
    void shouldDefaultToWorkingDirectory() {
        final ApplicationConfig config = mock(ApplicationConfig.class);
        when(config.getRepoArguments()).thenReturn(List.of());
        when(config.getWorkingDirectory()).thenReturn(Path.of("/work/my-project"));

        final List<RepoDescriptor> repos = GitWebdiffApplication.resolveRepos(config);

        assertThat(repos).containsExactly(new RepoDescriptor("my-project", Path.of("/work/my-project")));
    }

    @Test
    @DisplayName("Should parse repository arguments and suffix repeated labels")
    void shouldResolveRepoArguments() {
        final ApplicationConfig config = mock(ApplicationConfig.class);
        when(config.getRepoArguments()).thenReturn(List.of("web:/src/a", "/src/b/web", "api:../api"));
        when(config.getWorkingDirectory()).thenReturn(Path.of("/work/current"));

        final List<RepoDescriptor> repos = GitWebdiffApplication.resolveRepos(config);

        assertThat(repos).containsExactly(
                new RepoDescriptor("web", Path.of("/src/a")),
                new RepoDescriptor("web-1", Path.of("/src/b/web")),
                new RepoDescriptor("api", Path.of("/work/api")));
    }
}
