package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.mirkosertic.gitwebdiff.repo.RefreshResult;
import org.jspecify.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReloadResponse(
        boolean success,
        @Nullable String message,
        @Nullable String error
) {
    public static ReloadResponse from(final RefreshResult result) {
        return result.success()
                ? new ReloadResponse(true, result.message(), null)
                : new ReloadResponse(false, null, result.message());
    }
}
