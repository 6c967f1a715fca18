package de.mirkosertic.gitwebdiff.api.dto;

public record ErrorResponse(
        String error
) {
    public static ErrorResponse of(final Exception e) {
        final String message = e.getMessage();
        return new ErrorResponse(message == null || message.isBlank() ? e.getClass().getSimpleName() : message);
    }
}
