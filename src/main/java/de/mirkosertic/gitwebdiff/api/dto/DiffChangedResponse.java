package de.mirkosertic.gitwebdiff.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DiffChangedResponse(
        @JsonProperty("watch_enabled") boolean watchEnabled,
        boolean changed
) {
}
