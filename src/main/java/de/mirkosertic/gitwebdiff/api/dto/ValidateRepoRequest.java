package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Request DTO for {@code POST /api/repos/validate}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidateRepoRequest(
        @Nullable String label,
        @Nullable String path
) {
    public String effectiveLabel() {
        return label != null ? label : "";
    }

    public String effectivePath() {
        return path != null ? path : "";
    }
}
