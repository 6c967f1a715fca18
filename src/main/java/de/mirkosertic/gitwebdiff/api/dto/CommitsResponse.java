package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.gitwebdiff.history.Commit;
import de.mirkosertic.gitwebdiff.history.CommitPage;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Response of {@code GET /api/commits/{repoIdx}}.
 */
public record CommitsResponse(
        List<CommitInfo> commits,
        @JsonProperty("has_more") boolean hasMore,
        @Nullable String branch
) {
    public static CommitsResponse from(final CommitPage page) {
        final List<CommitInfo> commits = new ArrayList<>(page.commits().size());
        for (final Commit commit : page.commits()) {
            commits.add(CommitInfo.from(commit));
        }
        return new CommitsResponse(commits, page.hasMore(), page.branch());
    }
}
