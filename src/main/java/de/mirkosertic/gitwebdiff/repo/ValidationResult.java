package de.mirkosertic.gitwebdiff.repo;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a repository validation. {@code error} is set iff {@code valid} is false.
 */
public record ValidationResult(boolean valid, @Nullable String error) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(final String error) {
        return new ValidationResult(false, error);
    }
}
