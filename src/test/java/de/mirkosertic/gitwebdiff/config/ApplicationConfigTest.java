package de.mirkosertic.gitwebdiff.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @Test
    @DisplayName("Should load the classpath defaults")
    void shouldLoadDefaults() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        assertThat(config.getHost()).isEqualTo("localhost");
        assertThat(config.getPort()).isEqualTo(-1);
        assertThat(config.getTimeoutMinutes()).isZero();
        assertThat(config.getWatchIntervalSeconds()).isEqualTo(10);
        assertThat(config.isWatchEnabled()).isTrue();
        assertThat(config.getGitExecutable()).isEqualTo("git");
        assertThat(config.getGitArgs()).isEmpty();
        assertThat(config.getCheckTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getHistoryTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getStopGrace()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.isManageReposEnabled()).as("On by default for localhost").isTrue();
        assertThat(config.isManageReposExplicit()).isFalse();
    }

    @Test
    @DisplayName("Should parse options and treat the rest as git arguments")
    void shouldParseCommandLine() {
        final ApplicationConfig config = ApplicationConfig.defaults().applyCommandLine(CommandLineOptions.parse(
                "--host", "0.0.0.0", "-p", "8080", "--timeout", "15", "--watch", "3",
                "--git-repo", "web:/src/web", "--git-repo=/src/api", "HEAD~3..HEAD", "--", "src/"));

        assertThat(config.getHost()).isEqualTo("0.0.0.0");
        assertThat(config.getPort()).isEqualTo(8080);
        assertThat(config.getTimeoutMinutes()).isEqualTo(15);
        assertThat(config.getWatchIntervalSeconds()).isEqualTo(3);
        assertThat(config.getRepoArguments()).containsExactly("web:/src/web", "/src/api");
        assertThat(config.getGitArgs()).containsExactly("HEAD~3..HEAD", "--", "src/");
        assertThat(config.isLocalhost()).isFalse();
        assertThat(config.isManageReposEnabled()).as("Off by default for other hosts").isFalse();
    }

    @Test
    @DisplayName("Should let the negative flags win")
    void shouldApplyNegativeFlags() {
        final ApplicationConfig config = ApplicationConfig.defaults().applyCommandLine(CommandLineOptions.parse(
                "--watch", "5", "--no-watch", "--timeout", "10", "--no-timeout", "--manage-repos", "--no-manage-repos"));

        assertThat(config.isWatchEnabled()).isFalse();
        assertThat(config.getTimeoutMinutes()).isZero();
        assertThat(config.isManageReposEnabled()).isFalse();
        assertThat(config.isManageReposExplicit()).isTrue();
    }

    @Test
    @DisplayName("Should allow repository management on a public host when requested")
    void shouldEnableManagementExplicitly() {
        final ApplicationConfig config = ApplicationConfig.defaults()
                .applyCommandLine(CommandLineOptions.parse("--host", "example.org", "--manage-repos"));

        assertThat(config.isManageReposEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should keep file and environment values for options not given")
    void shouldKeepUnspecifiedValues() {
        final ApplicationConfig config = ApplicationConfig.defaults().applyCommandLine(CommandLineOptions.parse());

        assertThat(config.getPort()).isEqualTo(-1);
        assertThat(config.getWatchIntervalSeconds()).isEqualTo(10);
        assertThat(config.getGitArgs()).isEmpty();
        assertThat(config.isManageReposExplicit()).isFalse();
    }

    @Test
    @DisplayName("Should apply YAML settings from a user config file")
    void shouldApplyYaml() {
        final Map<String, Object> yaml = new Yaml().load("""
                webdiff:
                  server:
                    port: 9000
                  watch:
                    interval-seconds: 0
                  repos:
                    manage: false
                    list:
                      - docs:/srv/docs
                  git:
                    executable: /usr/local/bin/git
                    args: [--cached]
                  process:
                    stop-grace-seconds: 2
                """);

        final ApplicationConfig config = ApplicationConfig.defaults();
        config.applyYamlConfig(yaml);

        assertThat(config.getPort()).isEqualTo(9000);
        assertThat(config.isWatchEnabled()).isFalse();
        assertThat(config.isManageReposEnabled()).isFalse();
        assertThat(config.getRepoArguments()).containsExactly("docs:/srv/docs");
        assertThat(config.getGitExecutable()).isEqualTo("/usr/local/bin/git");
        assertThat(config.getGitArgs()).containsExactly("--cached");
        assertThat(config.getStopGrace()).isEqualTo(Duration.ofSeconds(2));
    }
}
