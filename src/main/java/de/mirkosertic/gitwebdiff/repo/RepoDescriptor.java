package de.mirkosertic.gitwebdiff.repo;

import java.nio.file.Path;

/**
 * A repository served by the server: a unique label and the path git runs in.
 */
public record RepoDescriptor(String label, Path path) {

    /**
     * Parse a {@code --git-repo} argument. {@code frontend:/path/to/repo} carries an explicit label,
     * a plain path is labelled with its directory name. Relative paths are resolved against {@code base}.
     */
    public static RepoDescriptor parse(final String argument, final Path base) {
        final int colon = argument.indexOf(':');
        if (colon > 0) {
            final String label = argument.substring(0, colon);
            final Path path = base.resolve(argument.substring(colon + 1)).toAbsolutePath().normalize();
            return new RepoDescriptor(label, path);
        }
        final Path path = base.resolve(argument).toAbsolutePath().normalize();
        return new RepoDescriptor(labelFor(path), path);
    }

    /**
     * The repository in {@code directory}, labelled with the directory name.
     */
    public static RepoDescriptor of(final Path directory) {
        final Path path = directory.toAbsolutePath().normalize();
        return new RepoDescriptor(labelFor(path), path);
    }

    public RepoDescriptor normalized() {
        return new RepoDescriptor(label, path.toAbsolutePath().normalize());
    }

    private static String labelFor(final Path path) {
        final Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }
}
