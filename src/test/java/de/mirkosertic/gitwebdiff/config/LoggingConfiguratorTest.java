package de.mirkosertic.gitwebdiff.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LoggingConfigurator Tests")
class LoggingConfiguratorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should keep console logging outside quiet mode")
    void shouldKeepConsoleLogging() {
        assertThat(LoggingConfigurator.configure(false)).isNull();
    }

    @Test
    @DisplayName("Should log below the user config directory by default")
    void shouldDefaultToConfigDirectory() {
        assertThat(LoggingConfigurator.logDirectory(null))
                .isEqualTo(ApplicationConfig.getConfigDirectory().resolve("log"));
        assertThat(LoggingConfigurator.logDirectory(" "))
                .isEqualTo(ApplicationConfig.getConfigDirectory().resolve("log"));
    }

    @Test
    @DisplayName("Should honor an explicit log directory")
    void shouldHonorOverride() {
        final Path custom = tempDir.resolve("logs");

        assertThat(LoggingConfigurator.logDirectory(custom.toString()))
                .as("Override should be used as absolute, normalized path")
                .isEqualTo(custom.toAbsolutePath().normalize());
    }
}
