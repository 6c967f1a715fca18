package de.mirkosertic.gitwebdiff.repo;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validation rules for repository descriptors. Pure functions, no state.
 */
public final class RepoValidator {

    private RepoValidator() {
    }

    /**
     * Validate one repository.
     */
    public static ValidationResult validateSingleRepo(final String label, final Path path) {
        if (label == null || label.isBlank()) {
            return ValidationResult.invalid("Label cannot be empty");
        }
        if (label.contains(":")) {
            return ValidationResult.invalid("Label cannot contain colon (:)");
        }
        if (path == null || !path.isAbsolute()) {
            return ValidationResult.invalid("Path must be absolute");
        }
        if (!Files.exists(path)) {
            return ValidationResult.invalid("Path does not exist");
        }
        if (!Files.isDirectory(path)) {
            return ValidationResult.invalid("Path is not a directory");
        }
        if (!Files.exists(path.resolve(".git"))) {
            return ValidationResult.invalid("Path is not a git repository (no .git directory)");
        }
        return ValidationResult.ok();
    }

    /**
     * Validate a complete repository list: non-empty, unique labels, unique normalized paths,
     * and every entry valid on its own.
     */
    public static ValidationResult validateRepoList(final List<RepoDescriptor> repos) {
        if (repos == null || repos.isEmpty()) {
            return ValidationResult.invalid("Must have at least one repository");
        }

        final Set<String> labels = new HashSet<>();
        final Set<String> duplicates = new LinkedHashSet<>();
        for (final RepoDescriptor repo : repos) {
            if (!labels.add(repo.label())) {
                duplicates.add(repo.label());
            }
        }
        if (!duplicates.isEmpty()) {
            return ValidationResult.invalid("Duplicate labels: " + String.join(", ", duplicates));
        }

        final Set<Path> paths = new HashSet<>();
        for (final RepoDescriptor repo : repos) {
            if (repo.path() != null && !paths.add(repo.path().toAbsolutePath().normalize())) {
                return ValidationResult.invalid("Duplicate paths not allowed");
            }
        }

        for (final RepoDescriptor repo : repos) {
            final ValidationResult result = validateSingleRepo(repo.label(), repo.path());
            if (!result.valid()) {
                return ValidationResult.invalid("Invalid repo '" + repo.label() + "': " + result.error());
            }
        }
        return ValidationResult.ok();
    }

    /**
     * Make labels unique by appending {@code -1}, {@code -2}, ... to repeated labels.
     */
    public static List<RepoDescriptor> ensureUniqueLabels(final List<RepoDescriptor> repos) {
        final Map<String, Integer> labelCounts = new HashMap<>();
        final List<RepoDescriptor> result = new ArrayList<>(repos.size());
        for (final RepoDescriptor repo : repos) {
            final String original = repo.label();
            final Integer count = labelCounts.get(original);
            if (count == null) {
                labelCounts.put(original, 1);
                result.add(repo);
            } else {
                labelCounts.put(original, count + 1);
                result.add(new RepoDescriptor(original + "-" + count, repo.path()));
            }
        }
        return result;
    }
}
