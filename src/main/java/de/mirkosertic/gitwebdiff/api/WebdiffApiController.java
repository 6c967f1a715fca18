package de.mirkosertic.gitwebdiff.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.gitwebdiff.api.dto.CommitsResponse;
import de.mirkosertic.gitwebdiff.api.dto.DiffChangedResponse;
import de.mirkosertic.gitwebdiff.api.dto.DiffListResponse;
import de.mirkosertic.gitwebdiff.api.dto.ErrorResponse;
import de.mirkosertic.gitwebdiff.api.dto.FileResponse;
import de.mirkosertic.gitwebdiff.api.dto.PairSummary;
import de.mirkosertic.gitwebdiff.api.dto.ReloadRequest;
import de.mirkosertic.gitwebdiff.api.dto.ReloadResponse;
import de.mirkosertic.gitwebdiff.api.dto.RepoInfo;
import de.mirkosertic.gitwebdiff.api.dto.ReposResponse;
import de.mirkosertic.gitwebdiff.api.dto.UpdateReposRequest;
import de.mirkosertic.gitwebdiff.api.dto.UpdateReposResponse;
import de.mirkosertic.gitwebdiff.api.dto.ValidateRepoRequest;
import de.mirkosertic.gitwebdiff.api.dto.ValidateRepoResponse;
import de.mirkosertic.gitwebdiff.diff.FileContentReader;
import de.mirkosertic.gitwebdiff.diff.FilePair;
import de.mirkosertic.gitwebdiff.history.CommitHistoryService;
import de.mirkosertic.gitwebdiff.history.CommitPage;
import de.mirkosertic.gitwebdiff.repo.RefreshError;
import de.mirkosertic.gitwebdiff.repo.RefreshResult;
import de.mirkosertic.gitwebdiff.repo.RepoDescriptor;
import de.mirkosertic.gitwebdiff.repo.RepoRegistry;
import de.mirkosertic.gitwebdiff.repo.RepoState;
import de.mirkosertic.gitwebdiff.repo.RepoValidator;
import de.mirkosertic.gitwebdiff.repo.ReplaceResult;
import de.mirkosertic.gitwebdiff.repo.ValidationResult;
import de.mirkosertic.gitwebdiff.watch.DiffChangeWatcher;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON endpoints of the diff server. Handlers only translate between HTTP and the services.
 */
public class WebdiffApiController {

    private static final Logger logger = LoggerFactory.getLogger(WebdiffApiController.class);

    static final String MANAGEMENT_DISABLED = "Repository management not enabled (use --manage-repos flag)";

    private final RepoRegistry registry;
    private final DiffChangeWatcher watcher;
    private final CommitHistoryService history;
    private final FileContentReader fileContentReader = new FileContentReader();
    private final boolean manageReposEnabled;
    private final ObjectMapper objectMapper;

    public WebdiffApiController(final RepoRegistry registry, final DiffChangeWatcher watcher,
                                final CommitHistoryService history, final boolean manageReposEnabled,
                                final ObjectMapper objectMapper) {
        this.registry = registry;
        this.watcher = watcher;
        this.history = history;
        this.manageReposEnabled = manageReposEnabled;
        this.objectMapper = objectMapper;
    }

    public void registerRoutes(final Javalin app) {
        app.get("/api/repos", ctx -> respond(ctx, repos()));
        app.get("/api/diff/{repoIdx}", ctx -> respond(ctx, diffList(ctx.pathParam("repoIdx"))));
        app.get("/api/diff-changed/{repoIdx}", this::handleDiffChanged);
        app.get("/file/{repoIdx}/{idx}", ctx -> respond(ctx, file(ctx.pathParam("repoIdx"), ctx.pathParam("idx"),
                "1".equals(ctx.queryParam("no_truncate")))));
        app.get("/api/commits/{repoIdx}", ctx -> respond(ctx, commits(ctx.pathParam("repoIdx"),
                ctx.queryParam("limit"), ctx.queryParam("offset"))));
        app.post("/api/server-reload/{repoIdx}", ctx -> respond(ctx, reload(ctx.pathParam("repoIdx"), ctx.body())));
        app.post("/api/repos/validate", ctx -> respond(ctx, validateRepo(ctx.body())));
        app.post("/api/repos/update", ctx -> respond(ctx, updateRepos(ctx.body())));
    }

    /**
     * Map anything a handler did not catch to a structured 500 response.
     */
    public void registerExceptionHandlers(final Javalin app) {
        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception for {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(ErrorResponse.of(e));
        });
    }

    private void handleDiffChanged(final Context ctx) {
        ctx.header("Cache-Control", "no-store, no-cache, must-revalidate, max-age=0");
        ctx.header("Pragma", "no-cache");
        ctx.header("Expires", "0");
        respond(ctx, diffChanged(ctx.pathParam("repoIdx")));
    }

    private static void respond(final Context ctx, final ApiResponse response) {
        ctx.status(response.status()).json(response.body());
    }

    // ==================== Handlers ====================

    ApiResponse repos() {
        final List<RepoInfo> repos = new ArrayList<>();
        for (final RepoDescriptor descriptor : registry.getDescriptors()) {
            repos.add(RepoInfo.from(descriptor));
        }
        return ApiResponse.ok(new ReposResponse(repos, watcher.isEnabled(), manageReposEnabled));
    }

    ApiResponse diffList(final String repoIdx) {
        final RepoState state = stateFor(repoIdx);
        if (state == null) {
            return invalidRepo(repoIdx);
        }
        final List<FilePair> pairs = state.getSnapshot();
        final List<PairSummary> summaries = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            summaries.add(PairSummary.of(i, pairs.get(i)));
        }
        return ApiResponse.ok(new DiffListResponse(state.getLabel(), state.getGitArgs(), summaries));
    }

    ApiResponse diffChanged(final String repoIdx) {
        final int index = parseIndex(repoIdx);
        if (registry.getState(index) == null) {
            return invalidRepo(repoIdx);
        }
        return ApiResponse.ok(new DiffChangedResponse(watcher.isEnabled(), watcher.hasChanged(index)));
    }

    ApiResponse file(final String repoIdx, final String idx, final boolean noTruncate) {
        final RepoState state = stateFor(repoIdx);
        if (state == null) {
            return invalidRepo(repoIdx);
        }
        final List<FilePair> pairs = state.getSnapshot();
        final int index = parseIndex(idx);
        if (index < 0 || index >= pairs.size()) {
            return ApiResponse.of(400, new ErrorResponse("Invalid file index " + idx));
        }
        final FilePair pair = pairs.get(index);
        return ApiResponse.ok(FileResponse.of(PairSummary.of(index, pair), fileContentReader.read(pair, !noTruncate)));
    }

    ApiResponse commits(final String repoIdx, final @Nullable String limit, final @Nullable String offset) {
        final RepoState state = stateFor(repoIdx);
        if (state == null) {
            return invalidRepo(repoIdx);
        }
        final CommitPage page;
        try {
            page = history.readPage(state.getDescriptor().path(),
                    parseQueryInt("limit", limit, CommitHistoryService.DEFAULT_LIMIT),
                    parseQueryInt("offset", offset, 0));
        } catch (final IllegalArgumentException e) {
            return ApiResponse.of(400, ErrorResponse.of(e));
        } catch (final IOException e) {
            logger.error("Error getting commits for repo {}: {}", repoIdx, e.getMessage());
            return ApiResponse.of(500, ErrorResponse.of(e));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApiResponse.of(500, new ErrorResponse("Interrupted while reading history"));
        }
        return ApiResponse.ok(CommitsResponse.from(page));
    }

    ApiResponse reload(final String repoIdx, final @Nullable String body) {
        final int index = parseIndex(repoIdx);
        if (registry.getState(index) == null) {
            return invalidRepo(repoIdx);
        }
        final List<String> gitArgs;
        try {
            gitArgs = parseReloadArgs(body);
        } catch (final IllegalArgumentException e) {
            return ApiResponse.of(400, new ReloadResponse(false, null, e.getMessage()));
        }
        final RefreshResult result = registry.refresh(index, gitArgs);
        if (result.success()) {
            return ApiResponse.ok(ReloadResponse.from(result));
        }
        logger.warn("Reload of repo {} failed: {}", index, result.message());
        return ApiResponse.of(statusFor(result.error()), ReloadResponse.from(result));
    }

    ApiResponse validateRepo(final @Nullable String body) {
        if (!manageReposEnabled) {
            return ApiResponse.of(403, ValidateRepoResponse.invalid(MANAGEMENT_DISABLED));
        }
        final ValidateRepoRequest request;
        try {
            request = objectMapper.readValue(body == null || body.isBlank() ? "{}" : body, ValidateRepoRequest.class);
        } catch (final JsonProcessingException e) {
            return ApiResponse.of(400, ValidateRepoResponse.invalid("Invalid request body: " + e.getOriginalMessage()));
        }

        final Path path;
        try {
            path = Path.of(request.effectivePath());
        } catch (final InvalidPathException e) {
            return ApiResponse.ok(ValidateRepoResponse.invalid("Path must be absolute"));
        }
        final ValidationResult result = RepoValidator.validateSingleRepo(request.effectiveLabel(), path);
        if (!result.valid()) {
            return ApiResponse.ok(ValidateRepoResponse.invalid(result.error()));
        }
        return ApiResponse.ok(ValidateRepoResponse.valid(request.effectiveLabel(),
                path.toAbsolutePath().normalize().toString()));
    }

    ApiResponse updateRepos(final @Nullable String body) {
        if (!manageReposEnabled) {
            return ApiResponse.of(403, UpdateReposResponse.error(MANAGEMENT_DISABLED));
        }
        final UpdateReposRequest request;
        try {
            request = objectMapper.readValue(body == null || body.isBlank() ? "{}" : body, UpdateReposRequest.class);
        } catch (final JsonProcessingException e) {
            return ApiResponse.of(400, UpdateReposResponse.error("Invalid request body: " + e.getOriginalMessage()));
        }

        final List<RepoDescriptor> descriptors = new ArrayList<>();
        for (final RepoInfo repo : request.effectiveRepos()) {
            descriptors.add(new RepoDescriptor(repo.label(), toPath(repo.path())));
        }

        final ReplaceResult result = registry.replaceAll(descriptors);
        if (!result.success()) {
            final int status = result.error() == ReplaceResult.Error.CRITICAL_ROLLBACK_FAILURE ? 500 : 400;
            return ApiResponse.of(status, UpdateReposResponse.error(result.message()));
        }
        final List<RepoInfo> repos = new ArrayList<>();
        for (final RepoDescriptor descriptor : registry.getDescriptors()) {
            repos.add(RepoInfo.from(descriptor));
        }
        return ApiResponse.ok(UpdateReposResponse.success(repos));
    }

    // ==================== Helpers ====================

    /**
     * Body is optional; missing, empty or unparsable bodies keep the current arguments.
     *
     * @throws IllegalArgumentException if {@code git_args} contains a null element
     */
    private @Nullable List<String> parseReloadArgs(final @Nullable String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        final List<String> gitArgs;
        try {
            gitArgs = objectMapper.readValue(body, ReloadRequest.class).gitArgs();
        } catch (final JsonProcessingException e) {
            logger.debug("Ignoring unparsable reload body: {}", e.getOriginalMessage());
            return null;
        }
        if (gitArgs != null && gitArgs.contains(null)) {
            throw new IllegalArgumentException("git_args must not contain null");
        }
        return gitArgs;
    }

    private static int statusFor(final @Nullable RefreshError error) {
        if (error == RefreshError.INVALID_REPO) {
            return 404;
        }
        if (error == RefreshError.ALREADY_IN_PROGRESS) {
            return 409;
        }
        if (error == RefreshError.SHUTTING_DOWN) {
            return 503;
        }
        return 500;
    }

    private @Nullable RepoState stateFor(final String repoIdx) {
        return registry.getState(parseIndex(repoIdx));
    }

    private static int parseIndex(final String repoIdx) {
        try {
            return Integer.parseInt(repoIdx);
        } catch (final NumberFormatException e) {
            return -1;
        }
    }

    private static int parseQueryInt(final String name, final @Nullable String value, final int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }

    private static @Nullable Path toPath(final @Nullable String path) {
        if (path == null) {
            return null;
        }
        try {
            return Path.of(path);
        } catch (final InvalidPathException e) {
            // Relative placeholder, rejected by validation as not absolute
            return Path.of("invalid");
        }
    }

    private static ApiResponse invalidRepo(final String repoIdx) {
        return ApiResponse.of(404, new ErrorResponse("Invalid repo index: " + repoIdx));
    }
}
