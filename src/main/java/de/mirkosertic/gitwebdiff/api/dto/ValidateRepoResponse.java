package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Response DTO for {@code POST /api/repos/validate}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidateRepoResponse(
        boolean valid,
        @Nullable String label,
        @Nullable String path,
        @Nullable String error
) {
    public static ValidateRepoResponse valid(final String label, final String path) {
        return new ValidateRepoResponse(true, label, path, null);
    }

    public static ValidateRepoResponse invalid(final String error) {
        return new ValidateRepoResponse(false, null, null, error);
    }
}
