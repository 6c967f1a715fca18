package de.mirkosertic.gitwebdiff.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the git-webdiff server.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Command line arguments
 * 2. Environment variables
 * 3. User config file (~/.gitwebdiff/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_GIT_ARGS = "WEBDIFF_GIT_ARGS";
    private static final String ENV_CWD = "WEBDIFF_CWD";
    private static final String ENV_PORT = "WEBDIFF_PORT";
    private static final String CONFIG_DIR = ".gitwebdiff";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Server settings
    private String host = "localhost";
    private int port = -1;
    private long timeoutMinutes = 0;

    // Watch settings
    private long watchIntervalSeconds = 10;

    // Repository settings
    private List<String> repoArguments = new ArrayList<>();
    private @Nullable Boolean manageRepos;
    private Path workingDirectory = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();

    // Git settings
    private String gitExecutable = "git";
    private List<String> gitArgs = new ArrayList<>();

    // Subprocess settings
    private long checkTimeoutSeconds = 30;
    private long protocolTimeoutSeconds = 30;
    private long checksumTimeoutSeconds = 30;
    private long historyTimeoutSeconds = 30;
    private long stopGraceSeconds = 5;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     *
     * @param options the parsed command line
     */
    public static ApplicationConfig load(final CommandLineOptions options) {
        final ApplicationConfig config = defaults();

        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.applyCommandLine(options);

        logger.info("Configuration loaded: host={}, port={}, watch={}s, timeout={}min, repos={}, gitArgs={}",
                config.host, config.port, config.watchIntervalSeconds, config.timeoutMinutes,
                config.repoArguments.size(), config.gitArgs);

        return config;
    }

    /**
     * Configuration holding only the classpath defaults.
     */
    static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> webdiffConfig = (Map<String, Object>) config.get("webdiff");
        if (webdiffConfig == null) {
            return;
        }

        final Map<String, Object> serverConfig = (Map<String, Object>) webdiffConfig.get("server");
        if (serverConfig != null) {
            if (serverConfig.containsKey("host")) {
                this.host = serverConfig.get("host").toString();
            }
            if (serverConfig.containsKey("port")) {
                this.port = ((Number) serverConfig.get("port")).intValue();
            }
            if (serverConfig.containsKey("timeout-minutes")) {
                this.timeoutMinutes = ((Number) serverConfig.get("timeout-minutes")).longValue();
            }
        }

        final Map<String, Object> watchConfig = (Map<String, Object>) webdiffConfig.get("watch");
        if (watchConfig != null && watchConfig.containsKey("interval-seconds")) {
            this.watchIntervalSeconds = ((Number) watchConfig.get("interval-seconds")).longValue();
        }

        final Map<String, Object> reposConfig = (Map<String, Object>) webdiffConfig.get("repos");
        if (reposConfig != null) {
            if (reposConfig.containsKey("manage")) {
                this.manageRepos = parseManageSetting(reposConfig.get("manage"));
            }
            final Object list = reposConfig.get("list");
            if (list instanceof List) {
                this.repoArguments = new ArrayList<>((List<String>) list);
            }
        }

        final Map<String, Object> gitConfig = (Map<String, Object>) webdiffConfig.get("git");
        if (gitConfig != null) {
            if (gitConfig.containsKey("executable")) {
                this.gitExecutable = gitConfig.get("executable").toString();
            }
            final Object args = gitConfig.get("args");
            if (args instanceof List) {
                this.gitArgs = new ArrayList<>((List<String>) args);
            }
        }

        final Map<String, Object> processConfig = (Map<String, Object>) webdiffConfig.get("process");
        if (processConfig != null) {
            if (processConfig.containsKey("check-timeout-seconds")) {
                this.checkTimeoutSeconds = ((Number) processConfig.get("check-timeout-seconds")).longValue();
            }
            if (processConfig.containsKey("protocol-timeout-seconds")) {
                this.protocolTimeoutSeconds = ((Number) processConfig.get("protocol-timeout-seconds")).longValue();
            }
            if (processConfig.containsKey("checksum-timeout-seconds")) {
                this.checksumTimeoutSeconds = ((Number) processConfig.get("checksum-timeout-seconds")).longValue();
            }
            if (processConfig.containsKey("history-timeout-seconds")) {
                this.historyTimeoutSeconds = ((Number) processConfig.get("history-timeout-seconds")).longValue();
            }
            if (processConfig.containsKey("stop-grace-seconds")) {
                this.stopGraceSeconds = ((Number) processConfig.get("stop-grace-seconds")).longValue();
            }
        }
    }

    private static @Nullable Boolean parseManageSetting(final @Nullable Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value == null || "auto".equalsIgnoreCase(value.toString())) {
            return null;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private void applyEnvironmentOverrides() {
        final String envCwd = System.getenv(ENV_CWD);
        if (envCwd != null && !envCwd.trim().isEmpty()) {
            this.workingDirectory = Paths.get(envCwd.trim()).toAbsolutePath().normalize();
            logger.info("Working directory from environment: {}", this.workingDirectory);
        }

        final String envPort = System.getenv(ENV_PORT);
        if (envPort != null && !envPort.trim().isEmpty()) {
            try {
                this.port = Integer.parseInt(envPort.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring non-numeric {}: {}", ENV_PORT, envPort);
            }
        }

        // Written by the git-webdiff launcher script with printf %q, plain words survive a whitespace split
        final String envGitArgs = System.getenv(ENV_GIT_ARGS);
        if (envGitArgs != null && !envGitArgs.trim().isEmpty()) {
            this.gitArgs = new ArrayList<>(List.of(envGitArgs.trim().split("\\s+")));
            logger.info("Git arguments from environment: {}", this.gitArgs);
        }
    }

    /**
     * Apply the options given on the command line. Unspecified options keep their current value.
     */
    ApplicationConfig applyCommandLine(final CommandLineOptions options) {
        if (options.getHost() != null) {
            this.host = options.getHost();
        }
        if (options.getPort() != null) {
            this.port = options.getPort();
        }
        if (options.getTimeoutMinutes() != null) {
            this.timeoutMinutes = options.getTimeoutMinutes();
        }
        if (options.getWatchIntervalSeconds() != null) {
            this.watchIntervalSeconds = options.getWatchIntervalSeconds();
        }
        if (options.getManageRepos() != null) {
            this.manageRepos = options.getManageRepos();
        }
        if (!options.getRepos().isEmpty()) {
            this.repoArguments = new ArrayList<>(options.getRepos());
        }
        final List<String> cliGitArgs = options.getGitArgs();
        if (!cliGitArgs.isEmpty()) {
            this.gitArgs = cliGitArgs;
        }
        return this;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public long getTimeoutMinutes() {
        return timeoutMinutes;
    }

    public long getWatchIntervalSeconds() {
        return watchIntervalSeconds;
    }

    public boolean isWatchEnabled() {
        return watchIntervalSeconds > 0;
    }

    public boolean isLocalhost() {
        return "localhost".equals(host) || "127.0.0.1".equals(host);
    }

    /**
     * Repository management defaults to enabled for localhost and disabled for any other host.
     */
    public boolean isManageReposEnabled() {
        return manageRepos != null ? manageRepos : isLocalhost();
    }

    public boolean isManageReposExplicit() {
        return manageRepos != null;
    }

    public List<String> getRepoArguments() {
        return repoArguments;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public String getGitExecutable() {
        return gitExecutable;
    }

    public List<String> getGitArgs() {
        return gitArgs;
    }

    public Duration getCheckTimeout() {
        return Duration.ofSeconds(checkTimeoutSeconds);
    }

    public Duration getProtocolTimeout() {
        return Duration.ofSeconds(protocolTimeoutSeconds);
    }

    public Duration getChecksumTimeout() {
        return Duration.ofSeconds(checksumTimeoutSeconds);
    }

    public Duration getHistoryTimeout() {
        return Duration.ofSeconds(historyTimeoutSeconds);
    }

    public Duration getStopGrace() {
        return Duration.ofSeconds(stopGraceSeconds);
    }
}
