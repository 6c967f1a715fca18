package de.mirkosertic.gitwebdiff.config;

import org.jspecify.annotations.Nullable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line of the server. Options not listed here are passed on to git, as is
 * everything after a literal {@code --}, which git needs to separate paths from revisions.
 */
@Command(
        name = "git-webdiff",
        sortOptions = false,
        versionProvider = CommandLineOptions.BuildInfoVersionProvider.class,
        description = "Serve the diff between two trees of a git repository over HTTP."
)
public final class CommandLineOptions {

    static final String END_OF_OPTIONS = "--";

    @Option(names = "--host", paramLabel = "HOST", description = "Host to serve on (default: localhost).")
    private @Nullable String host;

    @Option(names = {"-p", "--port"}, paramLabel = "PORT", description = "Port to serve on (default: random).")
    private @Nullable Integer port;

    @Option(names = "--timeout", paramLabel = "MINUTES",
            description = "Shut down the server after this many minutes (default: 0, no timeout).")
    private @Nullable Long timeoutMinutes;

    @Option(names = "--no-timeout", description = "Disable automatic timeout.")
    private boolean noTimeout;

    @Option(names = "--watch", paramLabel = "SECONDS",
            description = "Poll interval for diff change detection (default: 10).")
    private @Nullable Long watchIntervalSeconds;

    @Option(names = "--no-watch", description = "Disable watch mode.")
    private boolean noWatch;

    @Option(names = "--git-repo", paramLabel = "[LABEL:]PATH",
            description = "Repository to serve. Can be repeated.")
    private @Nullable List<String> repos;

    @Option(names = "--manage-repos", negatable = true,
            description = "Allow replacing the repository list over HTTP (default: only on localhost).")
    private @Nullable Boolean manageRepos;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
    private boolean helpRequested;

    @Option(names = {"-V", "--version"}, versionHelp = true, description = "Print version information and exit.")
    private boolean versionRequested;

    @Parameters(paramLabel = "GIT_ARGS", description = "Arguments passed to git diff and git difftool.")
    private @Nullable List<String> gitArgs;

    private final List<String> trailingGitArgs = new ArrayList<>();

    /**
     * Parse the arguments.
     *
     * @throws CommandLine.ParameterException if an option lacks a valid value
     */
    public static CommandLineOptions parse(final String... args) {
        final CommandLineOptions options = new CommandLineOptions();
        final int delimiter = Arrays.asList(args).indexOf(END_OF_OPTIONS);
        final String[] head = delimiter < 0 ? args : Arrays.copyOfRange(args, 0, delimiter);
        if (delimiter >= 0) {
            options.trailingGitArgs.addAll(Arrays.asList(args).subList(delimiter, args.length));
        }
        commandLine(options).parseArgs(head);
        return options;
    }

    public static void printUsage(final PrintStream out) {
        commandLine(new CommandLineOptions()).usage(out);
    }

    static String usage() {
        return commandLine(new CommandLineOptions()).getUsageMessage();
    }

    private static CommandLine commandLine(final CommandLineOptions options) {
        return new CommandLine(options)
                .setUnmatchedOptionsArePositionalParams(true)
                .setOverwrittenOptionsAllowed(true)
                .setExpandAtFiles(false);
    }

    public @Nullable String getHost() {
        return host;
    }

    public @Nullable Integer getPort() {
        return port;
    }

    /**
     * @return the timeout, 0 if {@code --no-timeout} was given, null if not specified
     */
    public @Nullable Long getTimeoutMinutes() {
        return noTimeout ? Long.valueOf(0) : timeoutMinutes;
    }

    /**
     * @return the watch interval, 0 if {@code --no-watch} was given, null if not specified
     */
    public @Nullable Long getWatchIntervalSeconds() {
        return noWatch ? Long.valueOf(0) : watchIntervalSeconds;
    }

    public List<String> getRepos() {
        return repos != null ? repos : List.of();
    }

    public @Nullable Boolean getManageRepos() {
        return manageRepos;
    }

    public List<String> getGitArgs() {
        final List<String> result = new ArrayList<>();
        if (gitArgs != null) {
            result.addAll(gitArgs);
        }
        result.addAll(trailingGitArgs);
        return result;
    }

    public boolean isHelpRequested() {
        return helpRequested;
    }

    public boolean isVersionRequested() {
        return versionRequested;
    }

    static final class BuildInfoVersionProvider implements CommandLine.IVersionProvider {

        @Override
        public String[] getVersion() {
            return new String[]{BuildInfo.describe()};
        }
    }
}
