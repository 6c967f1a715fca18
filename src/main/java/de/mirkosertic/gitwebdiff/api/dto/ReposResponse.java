package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for {@code GET /api/repos}.
 */
public record ReposResponse(
        List<RepoInfo> repos,
        @JsonProperty("watch_enabled") boolean watchEnabled,
        @JsonProperty("manage_repos") boolean manageReposEnabled
) {
}
