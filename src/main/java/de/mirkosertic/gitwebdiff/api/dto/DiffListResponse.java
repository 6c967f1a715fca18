package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for {@code GET /api/diff/{repoIdx}}.
 */
public record DiffListResponse(
        String label,
        @JsonProperty("git_args") List<String> gitArgs,
        List<PairSummary> pairs
) {
}
