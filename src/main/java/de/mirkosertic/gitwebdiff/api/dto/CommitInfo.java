package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.gitwebdiff.history.Commit;

public record CommitInfo(
        String hash,
        @JsonProperty("short_hash") String shortHash,
        String message,
        String author,
        String date,
        String relative
) {
    public static CommitInfo from(final Commit commit) {
        return new CommitInfo(commit.hash(), commit.shortHash(), commit.message(), commit.author(),
                commit.date(), commit.relative());
    }
}
