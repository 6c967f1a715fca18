package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Request DTO for {@code POST /api/repos/update}: the complete new repository list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdateReposRequest(
        @Nullable List<RepoInfo> repos
) {
    public List<RepoInfo> effectiveRepos() {
        return repos != null ? repos : List.of();
    }
}
