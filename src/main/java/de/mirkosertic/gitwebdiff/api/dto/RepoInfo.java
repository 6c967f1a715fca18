package de.mirkosertic.gitwebdiff.api.dto;

import de.mirkosertic.gitwebdiff.repo.RepoDescriptor;

/**
 * A repository as clients see it.
 */
public record RepoInfo(
        String label,
        String path
) {
    public static RepoInfo from(final RepoDescriptor descriptor) {
        return new RepoInfo(descriptor.label(), descriptor.path().toString());
    }
}
