package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.gitwebdiff.diff.FileContents;
import org.jspecify.annotations.Nullable;

/**
 * Response of {@code GET /file/{repoIdx}/{idx}}: the pair's metadata plus both contents.
 * Contents are null for the missing side of an add or delete, and for truncated pairs.
 */
public record FileResponse(
        int idx,
        PairSummary thick,
        boolean truncated,
        @JsonProperty("truncated_lines") int truncatedLines,
        @JsonProperty("truncated_bytes") long truncatedBytes,
        @JsonProperty("content_a") @Nullable String contentA,
        @JsonProperty("content_b") @Nullable String contentB
) {
    public static FileResponse of(final PairSummary pair, final FileContents contents) {
        return new FileResponse(pair.idx(), pair, contents.truncated(), contents.truncatedLines(),
                contents.truncatedBytes(), contents.contentA(), contents.contentB());
    }
}
