package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Optional body of {@code POST /api/server-reload/{repoIdx}}. Without {@code git_args} the
 * repository is reloaded with its current arguments.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReloadRequest(
        @Nullable
        @JsonProperty("git_args")
        List<String> gitArgs
) {
}
