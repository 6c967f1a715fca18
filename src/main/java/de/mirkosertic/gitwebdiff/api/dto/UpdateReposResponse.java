package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Response DTO for {@code POST /api/repos/update}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateReposResponse(
        boolean success,
        @Nullable List<RepoInfo> repos,
        @Nullable String error
) {
    public static UpdateReposResponse success(final List<RepoInfo> repos) {
        return new UpdateReposResponse(true, repos, null);
    }

    public static UpdateReposResponse error(final String errorMessage) {
        return new UpdateReposResponse(false, null, errorMessage);
    }
}
