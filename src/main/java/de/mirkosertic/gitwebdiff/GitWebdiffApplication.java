package de.mirkosertic.gitwebdiff;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.gitwebdiff.api.WebdiffApiController;
import de.mirkosertic.gitwebdiff.config.ApplicationConfig;
import de.mirkosertic.gitwebdiff.config.BuildInfo;
import de.mirkosertic.gitwebdiff.config.CommandLineOptions;
import de.mirkosertic.gitwebdiff.config.LoggingConfigurator;
import de.mirkosertic.gitwebdiff.diff.DiffChecksumCalculator;
import de.mirkosertic.gitwebdiff.diff.DirectoryDiffSnapshotComputer;
import de.mirkosertic.gitwebdiff.difftool.DifftoolLauncher;
import de.mirkosertic.gitwebdiff.difftool.DifftoolWrapperScript;
import de.mirkosertic.gitwebdiff.difftool.GitDiffCommands;
import de.mirkosertic.gitwebdiff.difftool.GitHistoryCommands;
import de.mirkosertic.gitwebdiff.difftool.ProcessLauncher;
import de.mirkosertic.gitwebdiff.history.CommitHistoryService;
import de.mirkosertic.gitwebdiff.repo.RefreshOrchestrator;
import de.mirkosertic.gitwebdiff.repo.RepoDescriptor;
import de.mirkosertic.gitwebdiff.repo.RepoRegistry;
import de.mirkosertic.gitwebdiff.repo.RepoValidator;
import de.mirkosertic.gitwebdiff.watch.DiffChangeWatcher;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point of the git-webdiff server.
 * Wires the services, loads every repository once and serves the HTTP API.
 */
public class GitWebdiffApplication {

    private static final Logger logger = LoggerFactory.getLogger(GitWebdiffApplication.class);

    private static final Duration REGISTRY_CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final ApplicationConfig config;
    private final RepoRegistry registry;
    private final DiffChangeWatcher watcher;
    private final WebdiffApiController apiController;
    private final ServerLifecycleSupervisor supervisor;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private Javalin javalin;

    public GitWebdiffApplication(final ApplicationConfig config, final Path wrapperScript) {
        this.config = config;

        final ProcessLauncher processLauncher = ProcessLauncher.system();
        final GitDiffCommands commands = new GitDiffCommands(processLauncher, config.getGitExecutable(),
                wrapperScript);

        final DifftoolLauncher difftoolLauncher = new DifftoolLauncher(
                commands,
                config.getCheckTimeout(),
                config.getProtocolTimeout(),
                config.getStopGrace()
        );

        final DiffChecksumCalculator checksumCalculator = new DiffChecksumCalculator(commands,
                config.getChecksumTimeout());

        final RefreshOrchestrator orchestrator = new RefreshOrchestrator(
                difftoolLauncher,
                new DirectoryDiffSnapshotComputer(),
                checksumCalculator
        );

        this.registry = new RepoRegistry(orchestrator, config.getGitArgs());

        this.watcher = new DiffChangeWatcher(registry, checksumCalculator,
                Duration.ofSeconds(config.getWatchIntervalSeconds()));

        final CommitHistoryService history = new CommitHistoryService(
                new GitHistoryCommands(processLauncher, config.getGitExecutable()),
                config.getHistoryTimeout());

        this.apiController = new WebdiffApiController(registry, watcher, history, config.isManageReposEnabled(),
                objectMapper);

        this.supervisor = new ServerLifecycleSupervisor(this::shutdown);
    }

    /**
     * Load every configured repository.
     *
     * @throws IllegalArgumentException if the repository list is invalid
     */
    public void init() {
        logger.info("Initializing {}...", BuildInfo.describe());

        final List<RepoDescriptor> repos = resolveRepos(config);
        registry.initialize(repos);

        if (config.isManageReposEnabled() && !config.isLocalhost()) {
            logger.warn("SECURITY WARNING: repository management is enabled on non-localhost host {}. "
                    + "Any client that can reach the server can point it at arbitrary directories.", config.getHost());
        }
    }

    /**
     * Start watching and serving.
     */
    public void start() {
        javalin = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper, false));
            cfg.http.defaultContentType = "application/json";
            cfg.showJavalinBanner = false;
        });
        apiController.registerRoutes(javalin);
        apiController.registerExceptionHandlers(javalin);

        final int port = config.getPort() == -1 ? 0 : config.getPort();
        javalin.start(config.getHost(), port);

        System.out.println("Starting git-webdiff server at http://" + config.getHost() + ":" + javalin.port());
        logger.info("Serving {} repo(s) on http://{}:{}", registry.size(), config.getHost(), javalin.port());

        watcher.start();
        if (watcher.isEnabled()) {
            System.out.println("Watch mode active: checking for changes every "
                    + config.getWatchIntervalSeconds() + " seconds");
        }

        supervisor.installShutdownHook();
        supervisor.scheduleTimeout(Duration.ofMinutes(config.getTimeoutMinutes()));
    }

    /**
     * Stop all services. Called once by the lifecycle supervisor.
     */
    void shutdown() {
        logger.info("Shutting down git-webdiff server...");

        try {
            watcher.stop();
        } catch (final Exception e) {
            logger.error("Error stopping watcher", e);
        }

        try {
            logger.info("Cleaning up difftool processes...");
            registry.close(REGISTRY_CLOSE_TIMEOUT);
        } catch (final Exception e) {
            logger.error("Error stopping difftool processes", e);
        }

        try {
            if (javalin != null) {
                javalin.stop();
            }
        } catch (final Exception e) {
            logger.error("Error stopping HTTP server", e);
        }

        logger.info("git-webdiff server shutdown complete");
    }

    /**
     * The repositories named on the command line, or the working directory if there are none.
     * Repeated labels get a numeric suffix.
     */
    static List<RepoDescriptor> resolveRepos(final ApplicationConfig config) {
        if (config.getRepoArguments().isEmpty()) {
            return List.of(RepoDescriptor.of(config.getWorkingDirectory()));
        }
        final List<RepoDescriptor> repos = new ArrayList<>();
        for (final String argument : config.getRepoArguments()) {
            repos.add(RepoDescriptor.parse(argument, config.getWorkingDirectory()));
        }
        return RepoValidator.ensureUniqueLabels(repos);
    }

    public static void main(final String[] args) {
        // Configure logging FIRST, before any other code that might log
        final boolean quietMode = "quiet".equals(System.getProperty("profile"));
        final Path logFile = LoggingConfigurator.configure(quietMode);
        if (logFile != null) {
            System.out.println("Logging to " + logFile);
        }

        final CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (final CommandLine.ParameterException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println();
            CommandLineOptions.printUsage(System.err);
            System.exit(1);
            return;
        }
        if (options.isHelpRequested()) {
            CommandLineOptions.printUsage(System.out);
            return;
        }
        if (options.isVersionRequested()) {
            System.out.println(BuildInfo.describe());
            return;
        }

        final ApplicationConfig config = ApplicationConfig.load(options);

        try {
            final Path wrapperScript = DifftoolWrapperScript.installTemporary();
            final GitWebdiffApplication app = new GitWebdiffApplication(config, wrapperScript);
            app.init();
            app.start();
        } catch (final IOException | RuntimeException e) {
            System.err.println("Failed to start git-webdiff server: " + e.getMessage());
            logger.error("Startup failed", e);
            System.exit(1);
        }
    }
}
