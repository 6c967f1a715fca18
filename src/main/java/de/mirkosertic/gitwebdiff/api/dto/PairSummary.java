package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.gitwebdiff.diff.FilePair;
import org.jspecify.annotations.Nullable;

/**
 * One entry of the thin file list. {@code a} is null for added files, {@code b} for deleted ones.
 */
public record PairSummary(
        int idx,
        @Nullable String a,
        @Nullable String b,
        String type,
        @JsonProperty("size_a") long sizeA,
        @JsonProperty("size_b") long sizeB
) {
    public static PairSummary of(final int idx, final FilePair pair) {
        return new PairSummary(idx, pair.a(), pair.b(), pair.type().label(), pair.sizeA(), pair.sizeB());
    }
}
